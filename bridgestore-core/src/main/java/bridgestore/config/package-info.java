/**
 * Environment access, settings and config resolution.
 *
 * @see bridgestore.config.ConfigResolver
 */
package bridgestore.config;
