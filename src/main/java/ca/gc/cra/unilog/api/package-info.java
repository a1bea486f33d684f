/**
 * Command-line entry points: {@code unilog emit} and {@code unilog event-type}.
 * <p>Commands return {@link ca.gc.cra.unilog.api.ExitCode} values; only {@link ca.gc.cra.unilog.api.Main#main}
 * exits the JVM.</p>
 */
package ca.gc.cra.unilog.api;
