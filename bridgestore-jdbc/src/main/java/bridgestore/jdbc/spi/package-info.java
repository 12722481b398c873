/**
 * Extension points for backend dialects.
 */
package bridgestore.jdbc.spi;
