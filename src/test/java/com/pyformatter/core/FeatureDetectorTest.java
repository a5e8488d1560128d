package com.pyformatter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.Feature;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.FormatterException;
import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.api.error.UnsupportedConstructException;
import com.pyformatter.tree.TreeBuilder;

class FeatureDetectorTest {

    private static Set<Feature> detect(String source) throws SourceSyntaxException {
        return FeatureDetector.detect(TreeBuilder.parse(source));
    }

    @Test
    void plainCodeUsesNoFeatures() throws SourceSyntaxException {
        assertTrue(detect("x = 1\nprint(x)\n").isEmpty());
    }

    @Test
    void literalFeatures() throws SourceSyntaxException {
        assertTrue(detect("x = f'{a}'\n").contains(Feature.F_STRINGS));
        assertTrue(detect("x = f'{a=}'\n").contains(Feature.DEBUG_F_STRINGS));
        assertFalse(detect("x = f'{a}'\n").contains(Feature.DEBUG_F_STRINGS));
        assertTrue(detect("x = 1_000\n").contains(Feature.NUMERIC_UNDERSCORES));
    }

    @Test
    void syntaxFeatures() throws SourceSyntaxException {
        assertTrue(detect("if (n := 1):\n    pass\n").contains(Feature.ASSIGNMENT_EXPRESSIONS));
        assertTrue(detect("def f(a, /, b):\n    pass\n").contains(Feature.POS_ONLY_ARGUMENTS));
        assertTrue(detect("match x:\n    case 1:\n        pass\n").contains(Feature.PATTERN_MATCHING));
        assertTrue(detect("try:\n    pass\nexcept* E:\n    pass\n").contains(Feature.EXCEPT_STAR));
    }

    @Test
    void typeParametersNeedPython312() throws SourceSyntaxException {
        assertTrue(detect("def f[T](x: T) -> T:\n    return x\n").contains(Feature.TYPE_PARAMS));
        assertTrue(detect("class C[T]:\n    pass\n").contains(Feature.TYPE_PARAMS));
        assertTrue(detect("type X = int\n").contains(Feature.TYPE_PARAMS));
        assertFalse(detect("type = int\n").contains(Feature.TYPE_PARAMS));
        assertEquals(EnumSet.of(TargetVersion.PY312),
                FeatureDetector.inferTargetVersions(EnumSet.of(Feature.TYPE_PARAMS)));
    }

    @Test
    void inferredVersionsSupportEveryUsedFeature() {
        Set<TargetVersion> versions = FeatureDetector.inferTargetVersions(EnumSet.of(Feature.PATTERN_MATCHING));
        assertEquals(EnumSet.of(TargetVersion.PY310, TargetVersion.PY311, TargetVersion.PY312), versions);
        assertEquals(EnumSet.allOf(TargetVersion.class), FeatureDetector.inferTargetVersions(EnumSet.noneOf(Feature.class)));
    }

    @Test
    void requestedVersionsMustSupportUsedFeatures() throws FormatterException {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> PythonFormatter.resolveTargetVersions(TreeBuilder.parse("x = f'{a}'\n"),
                        EnumSet.of(TargetVersion.PY35)));
        assertTrue(e.getMessage().contains("f-strings"));

        Set<TargetVersion> requested = EnumSet.of(TargetVersion.PY36, TargetVersion.PY37);
        assertEquals(requested, PythonFormatter.resolveTargetVersions(TreeBuilder.parse("x = f'{a}'\n"), requested));
    }
}
