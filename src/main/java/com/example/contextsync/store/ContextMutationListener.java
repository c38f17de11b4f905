package com.example.contextsync.store;

import com.example.contextsync.model.ContextSnapshot;

/**
 * Notified once per committed store mutation, after the writer lock has been
 * released, with the snapshot captured at commit time.
 */
@FunctionalInterface
public interface ContextMutationListener {

    void onMutation(ContextSnapshot snapshot);
}
