package com.pitlane.timing.application;

import com.pitlane.timing.domain.model.Event;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface FindSchedule {

    /**
     * Season schedule ordered by round. A stored schedule with too few races is refreshed
     * from the origin; if that fails the stored one is served as is.
     */
    CompletableFuture<List<Event>> execute(int year);
}
