package com.cinematic.engine.dispatch;

import com.cinematic.core.model.ResourceClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResourcePoolTest {

    @Test
    @DisplayName("Slots are bounded by capacity and tracked while held")
    void testCapacityBound() throws Exception {
        ResourcePool pool = new ResourcePool(ResourceClass.GPU, 2);

        pool.acquire();
        assertThat(pool.tryAcquire()).isTrue();
        assertThat(pool.tryAcquire()).isFalse();
        assertThat(pool.inUse()).isEqualTo(2);
        assertThat(pool.available()).isZero();

        pool.release();
        assertThat(pool.inUse()).isEqualTo(1);
        assertThat(pool.available()).isEqualTo(1);
        assertThat(pool.peakInUse()).isEqualTo(2);
    }

    @Test
    @DisplayName("Releasing a slot that was never acquired is rejected")
    void testReleaseWithoutAcquire() {
        ResourcePool pool = new ResourcePool(ResourceClass.CPU, 1);

        assertThatThrownBy(pool::release)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("CPU");
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    @DisplayName("A pool needs at least one slot")
    void testZeroCapacityRejected() {
        assertThatThrownBy(() -> new ResourcePool(ResourceClass.GPU, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
