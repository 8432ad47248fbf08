package com.rebenew.watchParty.syncserver.core;

/**
 * Hora del servidor con la que se anclan las posiciones de reproducción.
 * Nunca debe retroceder entre dos llamadas.
 */
public interface PlaybackClock {

    /**
     * Hora actual del servidor en milisegundos epoch.
     */
    long currentTimeMillis();
}
