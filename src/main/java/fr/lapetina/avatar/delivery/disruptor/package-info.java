/**
 * Outcome event stream.
 *
 * Each {@code speak} call publishes one outcome into a Disruptor ring buffer.
 * Consumer threads record metrics and notify listeners off the caller's thread.
 */
package fr.lapetina.avatar.delivery.disruptor;
