/**
 * Backend plug-in point: the capability a model runtime implements to execute batches.
 *
 * @see fr.lapetina.neuraforge.executor.ModelExecutor
 */
package fr.lapetina.neuraforge.executor;
