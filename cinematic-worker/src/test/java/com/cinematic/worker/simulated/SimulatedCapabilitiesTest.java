package com.cinematic.worker.simulated;

import com.cinematic.core.model.SceneTransition;
import com.cinematic.core.model.SoundEffectSpec;
import com.cinematic.core.model.TransitionType;
import com.cinematic.worker.AnimationRequest;
import com.cinematic.worker.ClipAsset;
import com.cinematic.worker.CompositionRequest;
import com.cinematic.worker.ImageAsset;
import com.cinematic.worker.ImageRequest;
import com.cinematic.worker.TransientCapabilityException;
import com.cinematic.worker.VideoAsset;
import com.cinematic.worker.storage.AssetNotFoundException;
import com.cinematic.worker.storage.InMemoryAssetStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class SimulatedCapabilitiesTest {

    private final InMemoryAssetStore store = new InMemoryAssetStore();
    private final SimulatedCapabilities capabilities = new SimulatedCapabilities(store, Duration.ZERO);

    @Test
    void fullChainWritesAssetsIntoTheirFolders() throws Exception {
        ImageAsset image = capabilities.generateImage(new ImageRequest(1, "a red balloon", "16:9"));
        ClipAsset clip = capabilities.animate(image, new AnimationRequest(1, 5, "16:9", "a red balloon"));
        ClipAsset mixed = capabilities.mixAudio(clip, List.of(new SoundEffectSpec("ambient", "wind")));
        VideoAsset video = capabilities.compose(new CompositionRequest(UUID.randomUUID(), "Balloon",
            List.of(mixed, clip), List.of(new SceneTransition(1, 2, TransitionType.FADE)), "16:9"));

        assertThat(image.key()).startsWith("images/").endsWith(".png");
        assertThat(clip.key()).startsWith("video/");
        assertThat(mixed.durationSeconds()).isEqualTo(5.0);
        assertThat(video.key()).startsWith("renders/");
        assertThat(video.durationSeconds()).isEqualTo(10.0);
        assertThat(store.size()).isEqualTo(4);
    }

    @Test
    void injectedRateLimitsFailTransientlyThenRecover() throws Exception {
        capabilities.injectRateLimits(2);
        ImageRequest request = new ImageRequest(1, "a fox", "1:1");

        assertThatThrownBy(() -> capabilities.generateImage(request))
            .isInstanceOf(TransientCapabilityException.class)
            .hasMessageContaining("429");
        assertThatThrownBy(() -> capabilities.generateImage(request))
            .isInstanceOf(TransientCapabilityException.class);
        assertThat(capabilities.generateImage(request).key()).startsWith("images/");
    }

    @Test
    void animatingMissingImageFailsPermanently() {
        assertThatThrownBy(() -> capabilities.animate(new ImageAsset("images/none.png"),
                new AnimationRequest(1, 5, "16:9", "x")))
            .isInstanceOf(AssetNotFoundException.class);
    }
}
