package com.identity.engine.dispatch;

import com.identity.core.model.EventCommand;

/**
 * Best-effort append of side-effect events.
 *
 * Dispatch returns immediately and never reports failures to the caller.
 * Nothing security or business logic relies on may be emitted this way.
 */
public interface EventDispatcher {

    void dispatch(String tenantId, EventCommand... commands);
}
