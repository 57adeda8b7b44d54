package com.cinematic.worker;

import com.cinematic.worker.safety.SafetyGate;
import com.cinematic.worker.simulated.SimulatedCapabilities;
import com.cinematic.worker.storage.AssetStore;

/**
 * The set of adapters a scheduler dispatches stages to.
 */
public record Capabilities(
    SafetyGate safetyGate,
    ImageGenerator imageGenerator,
    Animator animator,
    AudioMixer audioMixer,
    Composer composer,
    AssetStore assetStore
) {
    /**
     * Wire every generation capability to the simulated implementation.
     */
    public static Capabilities simulated(SafetyGate safetyGate, SimulatedCapabilities simulated, AssetStore assetStore) {
        return new Capabilities(safetyGate, simulated, simulated, simulated, simulated, assetStore);
    }
}
