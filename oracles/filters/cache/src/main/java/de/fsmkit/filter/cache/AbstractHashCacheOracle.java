/* Copyright (C) 2026 – FSMKit contributors
 * This file is part of FSMKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.fsmkit.filter.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import de.learnlib.api.oracle.MembershipOracle;
import de.learnlib.api.query.Query;
import net.automatalib.words.Word;

/**
 * A membership oracle remembering the answers of its delegate, keyed by the
 * whole input word. Only the queries missing from the cache are forwarded.
 *
 * @param <I> Input symbol type
 * @param <O> Output type
 * @author FSMKit contributors
 */
abstract class AbstractHashCacheOracle<I, O> implements MembershipOracle<I, O> {

    private final MembershipOracle<I, O> delegate;
    private final Map<Word<I>, O> cache = new HashMap<>();
    private final Lock cacheLock = new ReentrantLock();
    private long hits;
    private long misses;

    AbstractHashCacheOracle(MembershipOracle<I, O> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void processQueries(Collection<? extends Query<I, O>> queries) {
        List<ProxyQuery<I, O>> missed = new ArrayList<>();

        cacheLock.lock();
        try {
            for (Query<I, O> query : queries) {
                O answer = cache.get(query.getInput());
                if (answer != null) {
                    query.answer(answer);
                    hits++;
                } else {
                    missed.add(new ProxyQuery<>(query));
                }
            }
            misses += missed.size();
        } finally {
            cacheLock.unlock();
        }

        if (missed.isEmpty()) {
            return;
        }
        delegate.processQueries(missed);

        cacheLock.lock();
        try {
            for (ProxyQuery<I, O> miss : missed) {
                O answer = miss.getAnswer();
                if (answer != null) {
                    cache.put(miss.getInput(), answer);
                }
            }
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * @return The number of queries answered from the cache
     */
    public long getHits() {
        cacheLock.lock();
        try {
            return hits;
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * @return The number of queries forwarded to the delegate
     */
    public long getMisses() {
        cacheLock.lock();
        try {
            return misses;
        } finally {
            cacheLock.unlock();
        }
    }

    public int getCacheSize() {
        cacheLock.lock();
        try {
            return cache.size();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * Forgets every cached answer. The counters are kept.
     */
    public void clear() {
        cacheLock.lock();
        try {
            cache.clear();
        } finally {
            cacheLock.unlock();
        }
    }
}
