/**
 * Adapters for the logging ports: JSON formatting, rotating files, metrics, clocks, and executors.
 */
package ca.gc.cra.unilog.infrastructure;
