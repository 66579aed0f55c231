package org.l5xexport.l5x.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 例程逻辑条目：按例程类型区分的封闭和类型。
 * <ul>
 *   <li>{@link Rung}：梯形图（RLL）的一条梯级</li>
 *   <li>{@link StBlock}：结构化文本（ST）的一个内容块（当前版本或在线编辑版本）</li>
 *   <li>{@link FbdSummary}：功能块图（FBD）的结构摘要</li>
 *   <li>{@link SfcSummary}：顺序功能图（SFC）的结构摘要</li>
 *   <li>{@link Unknown}：未支持的例程类型占位</li>
 * </ul>
 * 新增条目类型时必须同时扩展 {@link Visitor}，所有格式化逻辑因此在编译期就会暴露遗漏。
 */
public sealed interface LogicItem
        permits LogicItem.Rung, LogicItem.StBlock, LogicItem.FbdSummary, LogicItem.SfcSummary, LogicItem.Unknown {

    String FBD_NOTE = "Function Block Diagram - graphical content summary only";
    String SFC_NOTE = "Sequential Function Chart - structure summary only";

    /**
     * 条目种类标签：{@code Rung}、{@code ST_Block}、{@code FBD}、{@code SFC}、{@code Unknown}。
     */
    String kind();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitRung(Rung rung);

        R visitStBlock(StBlock block);

        R visitFbd(FbdSummary summary);

        R visitSfc(SfcSummary summary);

        R visitUnknown(Unknown unknown);
    }

    /**
     * @param number          Number
     * @param rungType        Type（缺省 {@code N}，即普通梯级）
     * @param mainComment     无 Operand 的主注释
     * @param operandComments Operand -> 注释，每个操作数的注释单独保留
     * @param code            梯级指令文本，原样保留
     */
    record Rung(
            String number,
            String rungType,
            String mainComment,
            Map<String, String> operandComments,
            String code
    ) implements LogicItem {

        public static final String NORMAL = "N";

        public Rung {
            operandComments = Collections.unmodifiableMap(new LinkedHashMap<>(operandComments));
        }

        public boolean isNormal() {
            return NORMAL.equals(rungType);
        }

        @Override
        public String kind() {
            return "Rung";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRung(this);
        }
    }

    /**
     * @param onlineEditType OnlineEditType（当前/基础版本为空串）
     * @param code           各 Line 以换行拼接，缩进原样保留
     */
    record StBlock(String onlineEditType, String code) implements LogicItem {

        public boolean isOnlineEdit() {
            return !onlineEditType.isEmpty();
        }

        @Override
        public String kind() {
            return "ST_Block";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStBlock(this);
        }
    }

    record FbdSummary(int sheetCount, int blockCount, int wireCount, String note) implements LogicItem {

        @Override
        public String kind() {
            return "FBD";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFbd(this);
        }
    }

    record SfcSummary(
            int stepCount,
            List<String> stepNames,
            int transitionCount,
            int actionCount,
            String note
    ) implements LogicItem {

        public SfcSummary {
            stepNames = List.copyOf(stepNames);
        }

        @Override
        public String kind() {
            return "SFC";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSfc(this);
        }
    }

    /**
     * @param routineType 声明的例程类型原值
     * @param note        说明该类型尚未支持解码
     */
    record Unknown(String routineType, String note) implements LogicItem {

        public static Unknown of(String routineType) {
            return new Unknown(routineType, "Logic parsing for routine type \"" + routineType + "\" not implemented");
        }

        @Override
        public String kind() {
            return "Unknown";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnknown(this);
        }
    }
}
