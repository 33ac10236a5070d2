/**
 * CLI entry points that document, check and audit an environment against a configuration class.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging,
 * layers environment sources and invokes {@link ca.gc.cra.envbind.application.pipeline.EnvConfig}.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded and exit once output is flushed.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and truncates values echoed in logs.</p>
 */
package ca.gc.cra.envbind.api;
