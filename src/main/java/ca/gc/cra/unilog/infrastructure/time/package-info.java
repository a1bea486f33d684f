/**
 * Clock adapters.
 */
package ca.gc.cra.unilog.infrastructure.time;
