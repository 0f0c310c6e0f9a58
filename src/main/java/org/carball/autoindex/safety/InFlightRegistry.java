package org.carball.autoindex.safety;

import org.carball.autoindex.model.telemetry.FieldKey;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-key mutual exclusion for index builds. A lease covers exactly one key and
 * is released on close; closing twice is harmless.
 */
public class InFlightRegistry {

    private final Set<FieldKey> inFlight = ConcurrentHashMap.newKeySet();

    public Optional<Lease> tryAcquire(FieldKey key) {
        if (!inFlight.add(key)) {
            return Optional.empty();
        }
        return Optional.of(new Lease(key));
    }

    public boolean isHeld(FieldKey key) {
        return inFlight.contains(key);
    }

    public int size() {
        return inFlight.size();
    }

    public final class Lease implements AutoCloseable {
        private final FieldKey key;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(FieldKey key) {
            this.key = key;
        }

        public FieldKey getKey() {
            return key;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.remove(key);
            }
        }
    }
}
