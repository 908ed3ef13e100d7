package org.processcanvas.bpmn.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainmentTreeTest {
    private ContainmentTree tree;

    @BeforeEach
    void setUp() {
        tree = new ContainmentTree();
        tree.addPool("pool");
        tree.attachLane("pool", "lane_a");
        tree.attachLane("pool", "lane_b");
    }

    @Test
    void shouldResolveContainerThroughLane() {
        tree.assignMember("lane_b", "task");

        assertEquals(List.of("lane_a", "lane_b"), tree.lanesOf("pool"));
        assertEquals("lane_b", tree.laneOf("task"));
        assertEquals("pool", tree.containerOf("task"));
        assertEquals("pool", tree.poolOf("lane_a"));
        assertEquals(List.of("task"), tree.membersOf("lane_b"));
    }

    @Test
    void shouldKeepOrphanLanesWithoutContainer() {
        tree.addOrphanLane("lane_free");
        tree.assignMember("lane_free", "task");

        assertEquals(List.of("lane_free"), tree.orphanLanes());
        assertEquals("lane_free", tree.laneOf("task"));
        assertNull(tree.containerOf("task"));
    }

    @Test
    void shouldRejectSecondLaneForMember() {
        tree.assignMember("lane_a", "task");

        assertThrows(IllegalStateException.class, () -> tree.assignMember("lane_b", "task"));
    }

    @Test
    void shouldRejectPoolAsMemberOrLane() {
        tree.addPool("other");

        assertThrows(IllegalStateException.class, () -> tree.assignMember("lane_a", "other"));
        assertThrows(IllegalStateException.class, () -> tree.attachLane("pool", "other"));
    }

    @Test
    void shouldRejectLaneClaimedByTwoPools() {
        tree.addPool("other");

        assertThrows(IllegalStateException.class, () -> tree.attachLane("other", "lane_a"));
        assertThrows(IllegalStateException.class, () -> tree.attachLane("missing", "lane_c"));
    }
}
