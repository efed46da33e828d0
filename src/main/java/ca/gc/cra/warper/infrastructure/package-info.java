/**
 * Infrastructure adapters backing WARPER ports: process execution, worker pools, clocks, and metrics.
 */
package ca.gc.cra.warper.infrastructure;
