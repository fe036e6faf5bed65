package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.code.Code;
import com.vidnyan.tabula.domain.code.CodeRange;

import java.util.ArrayList;
import java.util.List;

/**
 * One decoded CNV data line, or several continuation lines merged into one.
 * Immutable value object.
 *
 * @param parentIdx declared parent index, {@code null} for a root category
 * @param codeSpec  raw code column as written in the file
 */
public record RawCategoryRecord(
    int idx,
    Integer parentIdx,
    String name,
    String codeSpec,
    List<Code> codes,
    List<CodeRange> ranges,
    int lineNumber
) {

    public RawCategoryRecord {
        codes = List.copyOf(codes);
        ranges = List.copyOf(ranges);
    }

    public boolean isRoot() {
        return parentIdx == null;
    }

    /**
     * Append a continuation line. Name, parent and line number of this record are kept.
     */
    public RawCategoryRecord merge(RawCategoryRecord continuation) {
        List<Code> mergedCodes = new ArrayList<>(codes);
        mergedCodes.addAll(continuation.codes());
        List<CodeRange> mergedRanges = new ArrayList<>(ranges);
        mergedRanges.addAll(continuation.ranges());
        String mergedSpec = codeSpec.isEmpty() ? continuation.codeSpec()
                : continuation.codeSpec().isEmpty() ? codeSpec
                : codeSpec + "," + continuation.codeSpec();
        return new RawCategoryRecord(idx, parentIdx, name, mergedSpec, mergedCodes, mergedRanges, lineNumber);
    }

    /**
     * Builder for RawCategoryRecord.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int idx;
        private Integer parentIdx;
        private String name = "";
        private String codeSpec = "";
        private List<Code> codes = List.of();
        private List<CodeRange> ranges = List.of();
        private int lineNumber;

        public Builder idx(int idx) { this.idx = idx; return this; }
        public Builder parentIdx(Integer parentIdx) { this.parentIdx = parentIdx; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder codeSpec(String codeSpec) { this.codeSpec = codeSpec; return this; }
        public Builder codes(List<Code> codes) { this.codes = codes; return this; }
        public Builder ranges(List<CodeRange> ranges) { this.ranges = ranges; return this; }
        public Builder lineNumber(int lineNumber) { this.lineNumber = lineNumber; return this; }

        public RawCategoryRecord build() {
            return new RawCategoryRecord(idx, parentIdx, name, codeSpec, codes, ranges, lineNumber);
        }
    }
}
