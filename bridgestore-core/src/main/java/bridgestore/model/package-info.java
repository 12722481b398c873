/**
 * Value types: configs, probe results, column requirements, reports and the
 * adapter lifecycle enum.
 */
package bridgestore.model;
