// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core.concurrent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NamedThreadFactoryTest {

    @Test
    void testThreadsNumberedAndDaemon() {
        NamedThreadFactory factory = new NamedThreadFactory("openmetrics-http");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertThat(first.getName()).isEqualTo("openmetrics-http-1");
        assertThat(second.getName()).isEqualTo("openmetrics-http-2");
        assertThat(first.isDaemon()).isTrue();
        assertThat(first.getState()).isEqualTo(Thread.State.NEW);
    }
}
