package com.cinematic.worker;

import com.cinematic.core.model.SoundEffectSpec;

import java.util.List;

/**
 * Audio processing capability. CPU-bound.
 */
@FunctionalInterface
public interface AudioMixer {

    /**
     * Mix sound effects into a clip.
     *
     * @param clip The silent clip
     * @param soundEffects Effects to mix in, never empty
     * @return A new clip with audio
     * @throws CapabilityException classified as transient or permanent
     */
    ClipAsset mixAudio(ClipAsset clip, List<SoundEffectSpec> soundEffects) throws CapabilityException;
}
