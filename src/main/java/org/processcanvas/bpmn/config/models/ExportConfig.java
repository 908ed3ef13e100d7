package org.processcanvas.bpmn.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings of the document writer.
 * <p>
 * Every exported element carries one metadata entry
 * {@code <prefix:metaData metaKey="..." metaValue="..."/>} inside its extensionElements.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {
    public String exporter;
    public String exporterVersion;
    public String targetNamespace;

    @JsonProperty("extension_namespace")
    public String extensionNamespace;

    @JsonProperty("extension_prefix")
    public String extensionPrefix;

    public String metaKey;
    public String metaValue;
}
