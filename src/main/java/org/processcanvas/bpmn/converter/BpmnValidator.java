package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

/**
 * Reads documents with the Camunda BPMN model API and validates them against the BPMN 2.0 schema.
 */
@Slf4j
public class BpmnValidator {

    /**
     * Validates a BPMN file from disk.
     * Throws an exception if invalid.
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
    }

    /**
     * Validates BPMN text, e.g. the output of an export.
     * Throws an exception if invalid.
     */
    public static void validate(String bpmnXml) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(bpmnXml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(File bpmnFile) {
        try {
            validate(bpmnFile);
            return true;
        } catch (Exception e) {
            log.debug("BPMN file {} is not valid: {}", bpmnFile, e.getMessage());
            return false;
        }
    }
}
