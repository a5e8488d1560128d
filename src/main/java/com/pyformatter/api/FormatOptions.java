package com.pyformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable set of options for one formatting call.
 */
public final class FormatOptions {
    public static final int DEFAULT_LINE_LENGTH = 88;

    private final int lineLength;
    private final Set<TargetVersion> targetVersions;
    private final boolean pyi;
    private final boolean skipStringNormalization;
    private final boolean skipMagicTrailingComma;
    private final Set<Preview> previewFeatures;
    private final List<LineRange> lineRanges;
    private final boolean fast;
    private final boolean diff;

    private FormatOptions(Builder builder) {
        this.lineLength = builder.lineLength;
        this.targetVersions = Collections.unmodifiableSet(EnumSet.copyOf(builder.targetVersions));
        this.pyi = builder.pyi;
        this.skipStringNormalization = builder.skipStringNormalization;
        this.skipMagicTrailingComma = builder.skipMagicTrailingComma;
        this.previewFeatures = Collections.unmodifiableSet(EnumSet.copyOf(builder.previewFeatures));
        this.lineRanges = Collections.unmodifiableList(new ArrayList<>(builder.lineRanges));
        this.fast = builder.fast;
        this.diff = builder.diff;
    }

    public static FormatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .lineLength(lineLength)
                .targetVersions(targetVersions)
                .pyi(pyi)
                .skipStringNormalization(skipStringNormalization)
                .skipMagicTrailingComma(skipMagicTrailingComma)
                .previewFeatures(previewFeatures)
                .lineRanges(lineRanges)
                .fast(fast)
                .diff(diff);
    }

    public int getLineLength() {
        return lineLength;
    }

    public Set<TargetVersion> getTargetVersions() {
        return targetVersions;
    }

    public boolean isPyi() {
        return pyi;
    }

    public boolean isSkipStringNormalization() {
        return skipStringNormalization;
    }

    public boolean isSkipMagicTrailingComma() {
        return skipMagicTrailingComma;
    }

    public boolean isMagicTrailingComma() {
        return !skipMagicTrailingComma;
    }

    public Set<Preview> getPreviewFeatures() {
        return previewFeatures;
    }

    public List<LineRange> getLineRanges() {
        return lineRanges;
    }

    public boolean isFast() {
        return fast;
    }

    public boolean isDiff() {
        return diff;
    }

    public boolean isPreview(Preview feature) {
        return previewFeatures.contains(feature);
    }

    /**
     * A stable textual digest of every option that influences the output, used for cache keys.
     */
    public String fingerprint() {
        String versions = targetVersions.stream()
                .map(TargetVersion::name)
                .collect(Collectors.joining(","));
        String preview = previewFeatures.stream()
                .map(Preview::name)
                .collect(Collectors.toCollection(TreeSet::new))
                .toString();
        return "ll=" + lineLength
                + ";tv=" + versions
                + ";pyi=" + pyi
                + ";ssn=" + skipStringNormalization
                + ";smtc=" + skipMagicTrailingComma
                + ";preview=" + preview
                + ";ranges=" + lineRanges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormatOptions)) {
            return false;
        }
        FormatOptions other = (FormatOptions) o;
        return lineLength == other.lineLength
                && pyi == other.pyi
                && skipStringNormalization == other.skipStringNormalization
                && skipMagicTrailingComma == other.skipMagicTrailingComma
                && fast == other.fast
                && diff == other.diff
                && targetVersions.equals(other.targetVersions)
                && previewFeatures.equals(other.previewFeatures)
                && lineRanges.equals(other.lineRanges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineLength, targetVersions, pyi, skipStringNormalization,
                skipMagicTrailingComma, previewFeatures, lineRanges, fast, diff);
    }

    @Override
    public String toString() {
        return "FormatOptions{" + fingerprint() + ";fast=" + fast + ";diff=" + diff + "}";
    }

    public static class Builder {
        private int lineLength = DEFAULT_LINE_LENGTH;
        private Set<TargetVersion> targetVersions = EnumSet.noneOf(TargetVersion.class);
        private boolean pyi;
        private boolean skipStringNormalization;
        private boolean skipMagicTrailingComma;
        private Set<Preview> previewFeatures = EnumSet.noneOf(Preview.class);
        private List<LineRange> lineRanges = new ArrayList<>();
        private boolean fast;
        private boolean diff;

        public Builder lineLength(int lineLength) {
            if (lineLength < 1) {
                throw new IllegalArgumentException("Line length must be positive: " + lineLength);
            }
            this.lineLength = lineLength;
            return this;
        }

        public Builder targetVersions(Set<TargetVersion> targetVersions) {
            this.targetVersions = targetVersions.isEmpty()
                    ? EnumSet.noneOf(TargetVersion.class)
                    : EnumSet.copyOf(targetVersions);
            return this;
        }

        public Builder addTargetVersion(TargetVersion version) {
            this.targetVersions.add(version);
            return this;
        }

        public Builder pyi(boolean pyi) {
            this.pyi = pyi;
            return this;
        }

        public Builder skipStringNormalization(boolean skip) {
            this.skipStringNormalization = skip;
            return this;
        }

        public Builder skipMagicTrailingComma(boolean skip) {
            this.skipMagicTrailingComma = skip;
            return this;
        }

        public Builder previewFeatures(Set<Preview> previewFeatures) {
            this.previewFeatures = previewFeatures.isEmpty()
                    ? EnumSet.noneOf(Preview.class)
                    : EnumSet.copyOf(previewFeatures);
            return this;
        }

        public Builder addPreviewFeature(Preview feature) {
            this.previewFeatures.add(feature);
            return this;
        }

        public Builder lineRanges(List<LineRange> lineRanges) {
            this.lineRanges = new ArrayList<>(lineRanges);
            return this;
        }

        public Builder addLineRange(LineRange range) {
            this.lineRanges.add(range);
            return this;
        }

        public Builder fast(boolean fast) {
            this.fast = fast;
            return this;
        }

        public Builder diff(boolean diff) {
            this.diff = diff;
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
