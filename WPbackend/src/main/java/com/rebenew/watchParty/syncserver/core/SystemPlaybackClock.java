package com.rebenew.watchParty.syncserver.core;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

// Reloj de pared que nunca retrocede (si el SO ajusta la hora, se queda en el último valor).
@Component
public class SystemPlaybackClock implements PlaybackClock {

    private final AtomicLong last = new AtomicLong();

    @Override
    public long currentTimeMillis() {
        return last.accumulateAndGet(System.currentTimeMillis(), Math::max);
    }
}
