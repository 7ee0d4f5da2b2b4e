package com.platform.releasecontroller.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.RenderedResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a multi-document YAML template into resources. Every document needs
 * {@code kind} and {@code metadata.name}; bodies are re-serialized so that equal
 * documents always render identically.
 */
@Component
public class YamlManifestRenderer implements ManifestRenderer {
    
    private final YAMLMapper yamlMapper = YAMLMapper.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .build();
    
    @Override
    public List<RenderedResource> render(Release release) {
        String template = release.getSpec() != null ? release.getSpec().template() : null;
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template is empty");
        }
        
        List<RenderedResource> rendered = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(template)) {
            int index = 0;
            while (documents.hasNextValue()) {
                JsonNode document = documents.nextValue();
                index++;
                if (document == null || document.isNull() || document.isEmpty()) {
                    continue;
                }
                String kind = document.path("kind").asText("");
                String name = document.path("metadata").path("name").asText("");
                if (kind.isEmpty() || name.isEmpty()) {
                    throw new IllegalArgumentException(
                        String.format("document %d has no kind or metadata.name", index));
                }
                if (!seen.add(kind + "/" + name)) {
                    throw new IllegalArgumentException(
                        String.format("duplicate resource %s/%s", kind, name));
                }
                rendered.add(new RenderedResource(kind, name, yamlMapper.writeValueAsString(document)));
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid YAML: " + e.getMessage(), e);
        }
        
        if (rendered.isEmpty()) {
            throw new IllegalArgumentException("template contains no resources");
        }
        return rendered;
    }
}
