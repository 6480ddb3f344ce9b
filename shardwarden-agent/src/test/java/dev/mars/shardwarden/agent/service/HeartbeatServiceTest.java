/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.shardwarden.agent.service;

import dev.mars.shardwarden.child.ChildMessage;
import dev.mars.shardwarden.child.ChildStats;
import dev.mars.shardwarden.child.CpuTimes;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.HeartbeatSettings;
import dev.mars.shardwarden.core.HeartbeatStyle;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HeartbeatService sampling against a scripted child channel.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-13
 */
@ExtendWith(VertxExtension.class)
class HeartbeatServiceTest {

    private static final HeartbeatSettings MESSAGE_STATS =
            new HeartbeatSettings(HeartbeatStyle.PULL, false, 5000, 60000, 90000, 120000, true);

    @TempDir
    Path projectDir;

    private final Deque<ChildStats> answers = new ArrayDeque<>();
    private boolean running;
    private HealthSnapshot status;
    private HeartbeatService service;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        Files.writeString(projectDir.resolve("bot.js"), "x".repeat(1024));
        running = true;
        status = new HealthSnapshot("abc");
        ChildChannel channel = new ChildChannel() {
            @Override
            public boolean isRunning() {
                return running;
            }

            @Override
            public Future<Void> send(ChildMessage message) {
                if (message instanceof ChildMessage.StatsRequest && !answers.isEmpty()) {
                    ChildStats next = answers.poll();
                    vertx.runOnContext(v -> service.onStats(next));
                }
                return Future.succeededFuture();
            }
        };
        service = new HeartbeatService(vertx, status, channel, new DiskUsageProbe(projectDir), 200);
    }

    private static ChildStats stats(long heapUsed, long messages, CpuTimes... cpus) {
        return new ChildStats(heapUsed, heapUsed * 2, heapUsed * 4, 10, List.of(cpus), messages, 1000);
    }

    @Test
    void cpuLoadIsTheBusyShareSinceTheLastSample() {
        List<CpuTimes> before = List.of(new CpuTimes(10, 0, 10, 80, 0), new CpuTimes(0, 0, 0, 100, 0));
        List<CpuTimes> after = List.of(new CpuTimes(30, 0, 30, 120, 0), new CpuTimes(0, 0, 0, 100, 0));

        assertEquals(List.of(0.5, 0.0), HeartbeatService.cpuLoad(before, after));
        assertEquals(List.of(0.0), HeartbeatService.cpuLoad(List.of(), List.of(new CpuTimes(1, 1, 1, 1, 1))));
    }

    @Test
    void messageDeltaRestartsWithTheCounter() {
        assertEquals(5, HeartbeatService.messageDelta(10, 15));
        assertEquals(3, HeartbeatService.messageDelta(10, 3));
    }

    @Test
    void sampleReportsChildAndDiskFigures(Vertx vertx, VertxTestContext testContext) {
        answers.add(stats(100, 7, new CpuTimes(1, 0, 1, 8, 0)));

        vertx.runOnContext(v -> service.sample().onComplete(testContext.succeeding(snapshot ->
                testContext.verify(() -> {
                    assertEquals("abc", snapshot.getId());
                    assertEquals(100, snapshot.getHeapUsed());
                    assertEquals(400, snapshot.getHeapMax());
                    assertEquals(7, snapshot.getMessageCountTotal());
                    assertEquals(7, snapshot.getMessageCountDelta());
                    assertEquals(List.of(0.0), snapshot.getCpuLoad());
                    assertTrue(snapshot.getDiskTotalBytes() > 0);
                    assertTrue(snapshot.getProjectDirBytes() >= 1024);
                    assertNotSame(status, snapshot);
                    testContext.completeNow();
                }))));
    }

    @Test
    void silentChildStillYieldsASnapshot(Vertx vertx, VertxTestContext testContext) {
        vertx.runOnContext(v -> service.sample().onComplete(testContext.succeeding(snapshot ->
                testContext.verify(() -> {
                    assertEquals(0, snapshot.getHeapUsed());
                    assertTrue(snapshot.getProjectDirBytes() >= 1024);
                    testContext.completeNow();
                }))));
    }

    @Test
    void missingChildStillYieldsASnapshot(Vertx vertx, VertxTestContext testContext) {
        running = false;

        vertx.runOnContext(v -> service.sample().onComplete(testContext.succeeding(snapshot ->
                testContext.verify(() -> {
                    assertTrue(snapshot.getDiskTotalBytes() > 0);
                    testContext.completeNow();
                }))));
    }

    @Test
    void idleWorkerIsRespawnedAfterTwoQuietSamples(Vertx vertx, VertxTestContext testContext) {
        for (int i = 0; i < 3; i++) {
            answers.add(stats(100, 5));
        }

        vertx.runOnContext(v -> service.sample()
                .compose(s -> {
                    testContext.verify(() -> assertFalse(service.needsRespawn(MESSAGE_STATS)));
                    return service.sample();
                })
                .compose(s -> {
                    testContext.verify(() -> assertFalse(service.needsRespawn(MESSAGE_STATS)));
                    return service.sample();
                })
                .onComplete(testContext.succeeding(s -> testContext.verify(() -> {
                    assertEquals(0, s.getMessageCountDelta());
                    assertTrue(service.needsRespawn(MESSAGE_STATS));
                    assertFalse(service.needsRespawn(MESSAGE_STATS));
                    testContext.completeNow();
                }))));
    }

    @Test
    void masterPartitionIsNeverRespawnedForIdleness(Vertx vertx, VertxTestContext testContext) {
        status.setMaster(true);
        for (int i = 0; i < 3; i++) {
            answers.add(stats(100, 0));
        }

        vertx.runOnContext(v -> service.sample()
                .compose(s -> service.sample())
                .compose(s -> service.sample())
                .onComplete(testContext.succeeding(s -> testContext.verify(() -> {
                    assertFalse(service.needsRespawn(MESSAGE_STATS));
                    assertFalse(service.needsRespawn(HeartbeatSettings.defaults()));
                    testContext.completeNow();
                }))));
    }

    @Test
    void childStartResetsCounters(Vertx vertx, VertxTestContext testContext) {
        answers.add(stats(100, 50));

        vertx.runOnContext(v -> service.sample().onComplete(testContext.succeeding(s -> {
            service.onChildStarted();
            testContext.verify(() -> {
                assertEquals(50, s.getMessageCountTotal());
                assertEquals(0, status.getMessageCountTotal());
                assertTrue(status.getCpuLoad().isEmpty());
                testContext.completeNow();
            });
        })));
    }
}
