package org.processcanvas.bpmn.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit ownership tree: pool -> ordered lanes -> member node ids.
 * A lane has at most one pool, a member has at most one lane, and a pool can never be a member.
 * Lanes without a pool ("orphan lanes") are allowed and keep their members.
 */
public class ContainmentTree {
    private final Map<String, List<String>> lanesByPool = new LinkedHashMap<>();
    private final Map<String, String> poolByLane = new LinkedHashMap<>();
    private final Map<String, List<String>> membersByLane = new LinkedHashMap<>();
    private final Map<String, String> laneByMember = new LinkedHashMap<>();

    public void addPool(String poolId) {
        if (membersByLane.containsKey(poolId) || laneByMember.containsKey(poolId)) {
            throw new IllegalStateException(String.format("'%s' is already a lane or lane member and cannot be a pool", poolId));
        }
        lanesByPool.putIfAbsent(poolId, new ArrayList<>());
    }

    /**
     * Appends a lane to a pool's lane list.
     *
     * @throws IllegalStateException if the pool is unknown or the lane already exists
     */
    public void attachLane(String poolId, String laneId) {
        List<String> lanes = lanesByPool.get(poolId);
        if (lanes == null) {
            throw new IllegalStateException(String.format("Lane '%s' refers to unknown pool '%s'", laneId, poolId));
        }
        if (membersByLane.containsKey(laneId)) {
            throw new IllegalStateException(String.format("Lane '%s' is already owned by '%s', cannot attach it to pool '%s'",
                    laneId, poolByLane.getOrDefault(laneId, "no pool"), poolId));
        }
        checkNotPool(laneId);
        lanes.add(laneId);
        poolByLane.put(laneId, poolId);
        membersByLane.put(laneId, new ArrayList<>());
    }

    /**
     * Records a lane that belongs to no pool.
     *
     * @throws IllegalStateException if the lane already exists
     */
    public void addOrphanLane(String laneId) {
        if (membersByLane.containsKey(laneId)) {
            throw new IllegalStateException(String.format("Lane '%s' is already recorded", laneId));
        }
        checkNotPool(laneId);
        membersByLane.put(laneId, new ArrayList<>());
    }

    /**
     * Assigns a node to a lane.
     *
     * @throws IllegalStateException if the lane is unknown, the node is a pool, or the node already has a lane
     */
    public void assignMember(String laneId, String nodeId) {
        List<String> members = membersByLane.get(laneId);
        if (members == null) {
            throw new IllegalStateException(String.format("Node '%s' refers to unknown lane '%s'", nodeId, laneId));
        }
        if (lanesByPool.containsKey(nodeId)) {
            throw new IllegalStateException(String.format("Pool '%s' cannot be a member of lane '%s'", nodeId, laneId));
        }
        String current = laneByMember.get(nodeId);
        if (current != null) {
            throw new IllegalStateException(String.format("Node '%s' is already in lane '%s', cannot assign it to lane '%s'",
                    nodeId, current, laneId));
        }
        members.add(nodeId);
        laneByMember.put(nodeId, laneId);
    }

    private void checkNotPool(String laneId) {
        if (lanesByPool.containsKey(laneId)) {
            throw new IllegalStateException(String.format("Pool '%s' cannot be used as a lane", laneId));
        }
    }

    public boolean isPool(String id) {
        return lanesByPool.containsKey(id);
    }

    public boolean hasLane(String laneId) {
        return membersByLane.containsKey(laneId);
    }

    public boolean isAssigned(String nodeId) {
        return laneByMember.containsKey(nodeId);
    }

    public List<String> pools() {
        return List.copyOf(lanesByPool.keySet());
    }

    public List<String> lanesOf(String poolId) {
        return Collections.unmodifiableList(lanesByPool.getOrDefault(poolId, List.of()));
    }

    public List<String> membersOf(String laneId) {
        return Collections.unmodifiableList(membersByLane.getOrDefault(laneId, List.of()));
    }

    /**
     * @return the pool owning the lane, or null for orphan and unknown lanes
     */
    public String poolOf(String laneId) {
        return poolByLane.get(laneId);
    }

    /**
     * @return the lane the node is a member of, or null
     */
    public String laneOf(String nodeId) {
        return laneByMember.get(nodeId);
    }

    /**
     * @return the pool containing the node through its lane, or null
     */
    public String containerOf(String nodeId) {
        String laneId = laneByMember.get(nodeId);
        return laneId == null ? null : poolByLane.get(laneId);
    }

    public List<String> orphanLanes() {
        return membersByLane.keySet().stream()
                .filter(laneId -> !poolByLane.containsKey(laneId))
                .toList();
    }
}
