package com.phillippitts.wordassist.service.execution;

import org.springframework.stereotype.Component;

/** {@link Sleeper} that blocks the calling thread. */
@Component
class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}
