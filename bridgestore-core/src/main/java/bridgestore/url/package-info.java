/**
 * Parsing and redaction of PostgreSQL connection URLs.
 */
package bridgestore.url;
