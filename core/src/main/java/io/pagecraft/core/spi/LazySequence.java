package io.pagecraft.core.spi;

import java.util.Collections;
import java.util.Iterator;

/**
 * Pull-based source of loop values. May be infinite; consumers stop when {@link #hasNext()}
 * returns {@code false}. Restartable only by asking the evaluator for a new sequence.
 */
public interface LazySequence extends Iterator<Object> {

    /** Adapts an iterator. */
    static LazySequence of(Iterator<?> iterator) {
        return new LazySequence() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public Object next() {
                return iterator.next();
            }
        };
    }

    static LazySequence empty() {
        return of(Collections.emptyIterator());
    }
}
