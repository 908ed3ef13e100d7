package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.config.ConverterConfigHelper;
import org.processcanvas.bpmn.config.models.ConverterConfig;
import org.processcanvas.bpmn.converter.models.ContainmentResult;
import org.processcanvas.bpmn.converter.models.Diagnostic;
import org.processcanvas.bpmn.converter.models.DiagnosticCode;
import org.processcanvas.bpmn.converter.models.LaneRecord;
import org.processcanvas.bpmn.converter.models.LayoutIndex;
import org.processcanvas.bpmn.converter.models.ParticipantRecord;
import org.processcanvas.bpmn.converter.models.ShapeBounds;
import org.processcanvas.bpmn.graph.ContainmentTree;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.processcanvas.bpmn.converter.BpmnDom.BPMN_NS;

/**
 * Third import stage: reconciles participants with the lane sets of all process fragments.
 * <p>
 * A process belongs to the first participant whose processRef names it. Its lanes, nested lanes flattened
 * in document order, attach to that pool. Lanes of processes no participant owns are orphan lanes: they
 * label their members but never attach to a pool.
 */
@Slf4j
public class ContainmentResolver {

    /**
     * @param doc    the parsed document
     * @param layout diagram index, for lane heights
     * @param config palettes and the default lane height
     * @return pools, lanes, lane membership and the recoverable diagnostics
     * @throws BpmnSchemaException if the document has no process, or has participants none of which owns one
     */
    public static ContainmentResult resolve(Document doc, LayoutIndex layout, ConverterConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        List<Element> processEls = BpmnDom.descendants(doc, BPMN_NS, "process");
        if (processEls.isEmpty()) {
            throw new BpmnSchemaException("Document contains no process");
        }
        List<String> processIds = new ArrayList<>();
        for (Element processEl : processEls) {
            String processId = BpmnDom.attr(processEl, "id");
            if (processId != null) {
                processIds.add(processId);
            }
        }

        ContainmentTree tree = new ContainmentTree();
        Map<String, ParticipantRecord> participants = readParticipants(doc, config, tree, diagnostics);
        Map<String, String> ownerByProcess = assignProcessOwners(participants, processIds, diagnostics);

        if (!participants.isEmpty() && ownerByProcess.isEmpty()) {
            String firstId = participants.keySet().iterator().next();
            throw new BpmnSchemaException(
                    String.format("None of the %d participants references a process", participants.size()), firstId);
        }

        Map<String, LaneRecord> lanes = new LinkedHashMap<>();
        for (Element processEl : processEls) {
            String processId = BpmnDom.attr(processEl, "id");
            String owner = processId == null ? null : ownerByProcess.get(processId);
            for (Element laneEl : BpmnDom.descendants(processEl, BPMN_NS, "lane")) {
                readLane(laneEl, processId, owner, layout, config, tree, lanes, diagnostics);
            }
        }

        log.debug("Resolved {} pools, {} lanes ({} orphan) across {} processes",
                participants.size(), lanes.size(), tree.orphanLanes().size(), processIds.size());
        return new ContainmentResult(participants, lanes, tree, processIds, diagnostics);
    }

    private static Map<String, ParticipantRecord> readParticipants(Document doc, ConverterConfig config,
                                                                   ContainmentTree tree, List<Diagnostic> diagnostics) {
        Map<String, ParticipantRecord> participants = new LinkedHashMap<>();
        int index = 0;
        for (Element collaborationEl : BpmnDom.descendants(doc, BPMN_NS, "collaboration")) {
            for (Element participantEl : BpmnDom.children(collaborationEl, BPMN_NS, "participant")) {
                String id = BpmnDom.attr(participantEl, "id");
                if (id == null) {
                    id = "Participant_" + (index + 1);
                }
                if (participants.containsKey(id)) {
                    diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_ID, id,
                            String.format("Participant '%s' is declared more than once, keeping the first", id)));
                    continue;
                }
                String name = NameCodec.decode(BpmnDom.attr(participantEl, "name"));
                participants.put(id, new ParticipantRecord(id, name == null ? id : name,
                        BpmnDom.attr(participantEl, "processRef"), ConverterConfigHelper.poolColor(config, index)));
                tree.addPool(id);
                index++;
            }
        }
        return participants;
    }

    private static Map<String, String> assignProcessOwners(Map<String, ParticipantRecord> participants,
                                                           List<String> processIds, List<Diagnostic> diagnostics) {
        Set<String> known = new HashSet<>(processIds);
        Map<String, String> ownerByProcess = new LinkedHashMap<>();
        for (ParticipantRecord participant : participants.values()) {
            String processRef = participant.processRef();
            if (processRef == null || !known.contains(processRef)) {
                continue;
            }
            String owner = ownerByProcess.putIfAbsent(processRef, participant.id());
            if (owner != null) {
                diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_LANE_CLAIM, participant.id(),
                        String.format("Process '%s' is already owned by pool '%s'; its lanes stay there, pool '%s' gets none",
                                processRef, owner, participant.id())));
            }
        }
        return ownerByProcess;
    }

    private static void readLane(Element laneEl, String processId, String owner, LayoutIndex layout,
                                 ConverterConfig config, ContainmentTree tree, Map<String, LaneRecord> lanes,
                                 List<Diagnostic> diagnostics) {
        int discoveryIndex = lanes.size();
        String laneId = BpmnDom.attr(laneEl, "id");
        if (laneId == null) {
            laneId = "Lane_" + (discoveryIndex + 1);
        }
        if (lanes.containsKey(laneId) || tree.isPool(laneId)) {
            LaneRecord first = lanes.get(laneId);
            diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_LANE_CLAIM, laneId,
                    String.format("Lane '%s' is claimed again in process '%s'; the first claim%s wins",
                            laneId, processId, first == null ? "" : " in process '" + first.processId() + "'")));
            return;
        }

        String name = NameCodec.decode(BpmnDom.attr(laneEl, "name"));
        ShapeBounds bounds = layout.shapeOf(laneId);
        LaneRecord lane = new LaneRecord(
                laneId,
                name == null ? "Lane " + (discoveryIndex + 1) : name,
                bounds == null ? config.lanes.defaultHeight : bounds.height(),
                ConverterConfigHelper.laneColor(config, discoveryIndex),
                processId);
        lanes.put(laneId, lane);
        if (owner != null) {
            tree.attachLane(owner, laneId);
        } else {
            tree.addOrphanLane(laneId);
        }

        // a parent lane repeats the members of its child lanes; those belong to the children
        Set<String> inherited = new HashSet<>();
        for (Element childLaneSet : BpmnDom.children(laneEl, BPMN_NS, "childLaneSet")) {
            for (Element ref : BpmnDom.descendants(childLaneSet, BPMN_NS, "flowNodeRef")) {
                String refId = BpmnDom.text(ref);
                if (refId != null) {
                    inherited.add(refId);
                }
            }
        }

        for (Element ref : BpmnDom.children(laneEl, BPMN_NS, "flowNodeRef")) {
            String memberId = BpmnDom.text(ref);
            if (memberId == null || inherited.contains(memberId)) {
                continue;
            }
            if (tree.isPool(memberId)) {
                diagnostics.add(Diagnostic.warning(DiagnosticCode.INVALID_LANE_MEMBER, memberId,
                        String.format("Lane '%s' lists pool '%s' as a member, ignored", laneId, memberId)));
            } else if (tree.isAssigned(memberId)) {
                diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_LANE_MEMBERSHIP, memberId,
                        String.format("Element '%s' is already in lane '%s', ignoring its membership of lane '%s'",
                                memberId, tree.laneOf(memberId), laneId)));
            } else {
                tree.assignMember(laneId, memberId);
            }
        }
    }
}
