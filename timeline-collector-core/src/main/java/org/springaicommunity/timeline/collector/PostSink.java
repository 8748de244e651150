package org.springaicommunity.timeline.collector;

/**
 * Downstream consumer of a finished run.
 */
@FunctionalInterface
public interface PostSink {

	void accept(CollectionResult result);

}
