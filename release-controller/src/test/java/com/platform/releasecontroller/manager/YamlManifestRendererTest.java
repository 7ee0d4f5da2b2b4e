package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseSpec;
import com.platform.releasecontroller.model.RenderedResource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class YamlManifestRendererTest {

    private final YamlManifestRenderer renderer = new YamlManifestRenderer();

    @Test
    void splitsDocumentsIntoResources() {
        String template = String.join("\n",
            "kind: ConfigMap",
            "metadata:",
            "  name: settings",
            "data:",
            "  mode: fast",
            "---",
            "kind: Deployment",
            "metadata:",
            "  name: web",
            "spec:",
            "  replicas: 2");

        List<RenderedResource> rendered = renderer.render(release(template));

        Assertions.assertEquals(2, rendered.size());
        Assertions.assertEquals("ConfigMap", rendered.get(0).kind());
        Assertions.assertEquals("settings", rendered.get(0).name());
        Assertions.assertEquals("Deployment", rendered.get(1).kind());
        Assertions.assertTrue(rendered.get(1).body().contains("replicas: 2"));
        Assertions.assertFalse(rendered.get(1).body().startsWith("---"));
    }

    @Test
    void skipsEmptyDocuments() {
        String template = "---\nkind: Service\nmetadata:\n  name: web\n---\n";

        List<RenderedResource> rendered = renderer.render(release(template));

        Assertions.assertEquals(1, rendered.size());
    }

    @Test
    void rendersDeterministically() {
        String template = "kind: Service\nmetadata:\n  name: web\n";

        Assertions.assertEquals(renderer.render(release(template)), renderer.render(release(template)));
    }

    @Test
    void rejectsInvalidTemplates() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> renderer.render(release("")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> renderer.render(release("kind: Service\n")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> renderer.render(release("kind: [unclosed")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> renderer.render(release(
            "kind: Service\nmetadata:\n  name: web\n---\nkind: Service\nmetadata:\n  name: web\n")));
    }

    private static Release release(String template) {
        return Release.of("a", "r1", ReleaseSpec.of(template));
    }
}
