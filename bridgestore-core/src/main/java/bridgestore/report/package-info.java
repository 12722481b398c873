/**
 * Redacted connection reporting.
 */
package bridgestore.report;
