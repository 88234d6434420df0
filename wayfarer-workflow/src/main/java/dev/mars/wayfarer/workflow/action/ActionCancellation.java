/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


package dev.mars.wayfarer.workflow.action;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to an action handler. Long-running handlers
 * should poll {@link #isCancelled()} or call {@link #throwIfCancelled()} between steps.
 */
public class ActionCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static ActionCancellation none() {
        return new ActionCancellation();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true if this call flipped the signal
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Action cancelled");
        }
    }

    @Override
    public String toString() {
        return "ActionCancellation{cancelled=" + cancelled.get() + '}';
    }
}
