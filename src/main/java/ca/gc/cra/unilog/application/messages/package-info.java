/**
 * Message envelope records and the helpers that inspect and decode them.
 */
package ca.gc.cra.unilog.application.messages;
