package com.modelgate.stream;

import com.modelgate.shared.model.StreamEvent;

import java.util.Iterator;

/**
 * @param events single-pass; blocks in {@code hasNext()} until the next event,
 *               the terminal event, or teardown; interrupting the waiting
 *               thread aborts the stream with a
 *               {@link com.modelgate.errors.StreamCancelledException}
 */
public record StreamTextResult(String requestId, Iterator<StreamEvent> events) {}
