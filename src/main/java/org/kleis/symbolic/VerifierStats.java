package org.kleis.symbolic;

import lombok.Getter;

/**
 * 验证器会话的计数快照。
 */
@Getter
public final class VerifierStats {

    private final int loadedStructures;
    private final int loadedDataTypes;
    private final int identityElements;
    private final int declaredFunctions;
    private final int assertedAxioms;
    private final int queries;

    public VerifierStats(int loadedStructures, int loadedDataTypes, int identityElements,
                         int declaredFunctions, int assertedAxioms, int queries) {
        this.loadedStructures = loadedStructures;
        this.loadedDataTypes = loadedDataTypes;
        this.identityElements = identityElements;
        this.declaredFunctions = declaredFunctions;
        this.assertedAxioms = assertedAxioms;
        this.queries = queries;
    }

    public static VerifierStats empty() {
        return new VerifierStats(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "结构 " + loadedStructures + "，数据类型 " + loadedDataTypes + "，元素 " + identityElements
                + "，函数 " + declaredFunctions + "，公理 " + assertedAxioms + "，查询 " + queries;
    }
}
