package com.example.docxcleaner;

import lombok.Value;

import java.util.List;
import java.util.Map;

/** 一次清理的统计结果 */
@Value
public class CleanSummary {
    /** 参与改写的文本部件数（含未命中、原样写回的部件） */
    int partsProcessed;
    /** 实际发生删除、重新序列化的部件数 */
    int partsRewritten;
    /** 原样复制的条目数 */
    int entriesCopied;
    long charactersRemoved;
    /** 码点 -> 删除次数 */
    Map<Integer, Integer> removedByCodePoint;
    /** 降级为原样复制的部件及原因 */
    List<String> warnings;
}
