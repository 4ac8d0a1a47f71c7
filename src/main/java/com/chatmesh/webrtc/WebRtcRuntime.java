package com.chatmesh.webrtc;

import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.media.MediaDevices;
import dev.onvoid.webrtc.media.audio.AudioDevice;
import dev.onvoid.webrtc.media.audio.AudioDeviceModule;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the native {@link PeerConnectionFactory} and audio device module shared by all
 * connections of a process.
 *
 * Platform-aware initialization:
 * - Windows: the AudioDeviceModule is created on a dedicated thread, since it needs COM
 * - Linux/macOS: created on the calling thread
 */
public final class WebRtcRuntime implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WebRtcRuntime.class.getName());

    private static final String OS_NAME = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    private static final boolean IS_WINDOWS = OS_NAME.contains("win");
    private static final long AUDIO_INIT_TIMEOUT_SECONDS = 15;

    private final AudioDeviceModule audioDeviceModule;
    private PeerConnectionFactory factory;

    private WebRtcRuntime(AudioDeviceModule audioDeviceModule, PeerConnectionFactory factory) {
        this.audioDeviceModule = audioDeviceModule;
        this.factory = factory;
    }

    /**
     * Loads the native library and creates the factory.
     *
     * @throws IllegalStateException if the native library or audio devices cannot be initialized
     */
    public static WebRtcRuntime start() {
        LOGGER.info("[WebRTC] Initializing native WebRTC on " + OS_NAME);
        AudioDeviceModule adm;
        try {
            adm = IS_WINDOWS ? createAudioModuleOnDedicatedThread() : createAudioModule();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while initializing audio", e);
        } catch (RuntimeException | LinkageError e) {
            throw new IllegalStateException("WebRTC audio initialization failed", e);
        }

        PeerConnectionFactory factory = adm != null ? new PeerConnectionFactory(adm) : new PeerConnectionFactory();
        LOGGER.info("[WebRTC] PeerConnectionFactory created" + (adm != null ? " with AudioDeviceModule" : ""));
        return new WebRtcRuntime(adm, factory);
    }

    private static AudioDeviceModule createAudioModule() {
        AudioDevice defaultMic = MediaDevices.getDefaultAudioCaptureDevice();
        AudioDevice defaultSpeaker = MediaDevices.getDefaultAudioRenderDevice();

        AudioDeviceModule adm = new AudioDeviceModule();
        if (defaultMic != null) {
            LOGGER.info("[WebRTC] Default microphone: " + defaultMic.getName());
            adm.setRecordingDevice(defaultMic);
            adm.initRecording();
        } else {
            LOGGER.info("[WebRTC] No microphone detected");
        }
        if (defaultSpeaker != null) {
            LOGGER.info("[WebRTC] Default speaker: " + defaultSpeaker.getName());
            adm.setPlayoutDevice(defaultSpeaker);
            adm.initPlayout();
        } else {
            LOGGER.info("[WebRTC] No speaker detected");
        }
        return adm;
    }

    private static AudioDeviceModule createAudioModuleOnDedicatedThread() throws InterruptedException {
        AtomicReference<AudioDeviceModule> admRef = new AtomicReference<>();
        AtomicReference<Throwable> errorRef = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        Thread initThread = new Thread(() -> {
            try {
                LOGGER.fine("[WebRTC] Audio init thread started (tid=" + Thread.currentThread().getId() + ")");
                admRef.set(createAudioModule());
            } catch (Throwable t) {
                errorRef.set(t);
            } finally {
                latch.countDown();
            }
        }, "webrtc-audio-init");
        initThread.setDaemon(true);
        initThread.start();

        if (!latch.await(AUDIO_INIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Audio initialization timed out after "
                + AUDIO_INIT_TIMEOUT_SECONDS + "s");
        }
        if (errorRef.get() != null) {
            throw new IllegalStateException("Audio initialization failed", errorRef.get());
        }
        return admRef.get();
    }

    public synchronized PeerConnectionFactory getFactory() {
        if (factory == null) {
            throw new IllegalStateException("WebRTC runtime is closed");
        }
        return factory;
    }

    public synchronized boolean isClosed() {
        return factory == null;
    }

    @Override
    public synchronized void close() {
        if (factory == null) {
            return;
        }
        LOGGER.info("[WebRTC] Shutting down WebRTC...");
        factory.dispose();
        factory = null;

        if (audioDeviceModule != null) {
            try {
                audioDeviceModule.dispose();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[WebRTC] Error disposing AudioDeviceModule", e);
            }
        }
        LOGGER.info("[WebRTC] WebRTC shutdown complete");
    }
}
