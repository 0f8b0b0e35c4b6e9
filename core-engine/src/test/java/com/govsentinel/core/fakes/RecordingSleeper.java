package com.govsentinel.core.fakes;

import com.govsentinel.core.ratelimit.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested pauses instead of sleeping.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private Runnable onSleep = () -> {
    };

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        onSleep.run();
    }

    /**
     * @param hook run after every recorded pause
     */
    public synchronized RecordingSleeper onSleep(Runnable hook) {
        this.onSleep = hook;
        return this;
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
