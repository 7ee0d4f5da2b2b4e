package com.platform.releasecontroller.cache;

import com.platform.releasecontroller.error.ErrorCode;
import com.platform.releasecontroller.error.KeyDecodeException;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ReleaseKeyTest {

    @Test
    void parsesNamespaceAndName() {
        ReleaseKey key = ReleaseKey.parse("team-a/web.frontend");

        Assertions.assertEquals("team-a", key.namespace());
        Assertions.assertEquals("web.frontend", key.name());
        Assertions.assertEquals("team-a/web.frontend", key.encode());
    }

    @Test
    void rejectsMalformedKeys() {
        for (String raw : new String[] {"bad::key::format", "", "a", "a/b/c", "/r1", "a/", "A/r1", "a/-r1"}) {
            KeyDecodeException e = Assertions.assertThrows(KeyDecodeException.class, () -> ReleaseKey.parse(raw), raw);
            Assertions.assertEquals(ErrorCode.INVALID_RELEASE_KEY, e.getErrorCode());
            Assertions.assertEquals(raw, e.getKey());
            Assertions.assertFalse(e.isRetryable());
        }
    }

    @Test
    void rejectsOverlongSegments() {
        String name = "r".repeat(254);

        Assertions.assertThrows(KeyDecodeException.class, () -> ReleaseKey.parse("a/" + name));
        Assertions.assertEquals(253, ReleaseKey.parse("a/" + "r".repeat(253)).name().length());
    }

    @Test
    void releaseAndTombstoneProduceTheSameKey() {
        Release release = Release.of("a", "r1", ReleaseSpec.of("kind: ConfigMap"));

        String fromRelease = ReleaseKey.keyFor(release);
        String fromTombstone = ReleaseKey.keyFor(new DeletedFinalStateUnknown("a/r1", release));

        Assertions.assertEquals("a/r1", fromRelease);
        Assertions.assertEquals(fromRelease, fromTombstone);
    }

    @Test
    void unsupportedPayloadHasNoKey() {
        Assertions.assertThrows(KeyDecodeException.class, () -> ReleaseKey.keyFor("a/r1"));
        Assertions.assertThrows(KeyDecodeException.class, () -> ReleaseKey.keyFor(null));
        Assertions.assertThrows(KeyDecodeException.class,
            () -> ReleaseKey.keyFor(new DeletedFinalStateUnknown("bad::key::format", null)));
    }
}
