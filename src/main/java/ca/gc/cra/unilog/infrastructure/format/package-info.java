/**
 * JSON-lines formatter built on the Jackson streaming generator.
 */
package ca.gc.cra.unilog.infrastructure.format;
