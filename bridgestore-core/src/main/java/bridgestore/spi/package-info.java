/**
 * Service provider interfaces implemented by {@code bridgestore-jdbc} and
 * {@code bridgestore-micrometer}.
 */
package bridgestore.spi;
