package com.acme.dcm.application.vmrequest;

import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;

/**
 * Write port for the request timeline read model.
 *
 * <p>Adding an entry whose id is already present is a successful no-op.
 */
public interface TimelineEventProjectionUpdater {

    Result<Void, ProjectionError> addTimelineEvent(TimelineEvent event);
}
