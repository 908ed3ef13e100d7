package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.config.ConverterConfigHelper;
import org.processcanvas.bpmn.config.models.ConverterConfig;
import org.processcanvas.bpmn.converter.models.ClassifiedElement;
import org.processcanvas.bpmn.converter.models.ContainmentResult;
import org.processcanvas.bpmn.converter.models.Diagnostic;
import org.processcanvas.bpmn.converter.models.ImportResult;
import org.processcanvas.bpmn.converter.models.LayoutIndex;
import org.processcanvas.bpmn.converter.models.StageResult;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.Graph;
import org.w3c.dom.Document;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the converter: BPMN text to graph and back.
 * <p>
 * Instances hold only their configuration and may be shared between threads.
 */
@Slf4j
public class BpmnConverter {
    private final ConverterConfig config;
    private final Supplier<IdSource> idSources;

    /**
     * Converter with the shipped defaults and clock-stamped export ids.
     */
    public BpmnConverter() {
        this(ConverterConfigHelper.loadDefaults());
    }

    public BpmnConverter(ConverterConfig config) {
        this(config, () -> new TimestampIdSource(Clock.systemUTC()));
    }

    /**
     * @param config    converter settings
     * @param idSources makes one id source per export call
     */
    public BpmnConverter(ConverterConfig config, Supplier<IdSource> idSources) {
        this.config = config;
        this.idSources = idSources;
    }

    /**
     * Imports a BPMN document.
     *
     * @param documentText the document
     * @return the graph plus the recoverable problems found on the way
     * @throws MalformedDocumentException if the text is not well-formed XML
     * @throws BpmnSchemaException        if there is no definitions root or no usable process
     */
    public ImportResult importBpmn(String documentText) {
        Document doc = BpmnDocumentReader.read(documentText);
        LayoutIndex layout = LayoutExtractor.extract(doc);

        List<Diagnostic> diagnostics = new ArrayList<>();
        ContainmentResult containment = ContainmentResolver.resolve(doc, layout, config);
        diagnostics.addAll(containment.diagnostics());

        Set<String> reservedIds = new HashSet<>(containment.participants().keySet());
        reservedIds.addAll(containment.lanes().keySet());
        StageResult<List<ClassifiedElement>> classified = ElementClassifier.classifyDocument(doc, reservedIds);
        diagnostics.addAll(classified.diagnostics());

        StageResult<List<Connection>> flows = FlowResolver.resolve(doc, classified.value(),
                containment.participants().keySet(), layout);
        diagnostics.addAll(flows.diagnostics());

        Graph graph = GraphAssembler.assemble(containment, classified.value(), flows.value(), layout, config);
        for (Diagnostic diagnostic : diagnostics) {
            log.warn("{} [{}]: {}", diagnostic.code(), diagnostic.elementId(), diagnostic.message());
        }
        log.info("Imported BPMN: {} nodes, {} connections, {} diagnostics",
                graph.nodes().size(), graph.connections().size(), diagnostics.size());
        return new ImportResult(graph, diagnostics);
    }

    /**
     * Exports a graph with a fresh id source from this converter.
     *
     * @param graph       a graph satisfying the graph invariants
     * @param processName display name of the main process
     * @return BPMN 2.0 XML with diagram interchange
     * @throws IllegalStateException if the graph breaks an invariant
     */
    public String exportBpmn(Graph graph, String processName) {
        return exportBpmn(graph, processName, idSources.get());
    }

    public String exportBpmn(Graph graph, String processName, IdSource idSource) {
        String xml = BpmnDocumentWriter.write(graph, processName, idSource, config);
        log.info("Exported BPMN process '{}': {} nodes, {} connections",
                processName, graph.nodes().size(), graph.connections().size());
        return xml;
    }
}
