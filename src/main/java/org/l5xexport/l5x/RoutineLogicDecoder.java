package org.l5xexport.l5x;

import org.l5xexport.l5x.dto.LogicItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 例程逻辑解码器：按例程声明的 {@code Type} 选择解码策略，统一输出 {@link LogicItem} 序列。
 * <p>
 * 各类型的处理方式：
 * <ul>
 *   <li>RLL：{@code RLLContent/Rung} 每条梯级一个条目，保留主注释与各操作数注释，指令文本原样保留。</li>
 *   <li>ST：每个 {@code STContent} 一个条目（在线编辑会产生多个内容块），{@code Line} 以换行拼接且不去空白。</li>
 *   <li>FBD：只统计 Sheet / Block / Wire 数量，不重建图形拓扑。</li>
 *   <li>SFC：只统计 Step / Transition / ActionStructure 数量，并列出步名。</li>
 *   <li>其它类型：输出一个 {@link LogicItem.Unknown} 占位条目。</li>
 * </ul>
 * <p>
 * 解码过程从不抛异常：缺失的可选元素/属性一律退化为空串或文档约定的缺省值，
 * 单个畸形梯级或未知类型不会影响其余例程、程序与报告的导出。
 */
public final class RoutineLogicDecoder {

    private static final Logger log = LoggerFactory.getLogger(RoutineLogicDecoder.class);

    private static final String UNNAMED_STEP = "unnamed";

    private final L5xDocument document;

    public RoutineLogicDecoder(L5xDocument document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public List<LogicItem> decode(Element routine, String declaredType) {
        switch (RoutineType.of(declaredType)) {
            case RLL:
                return decodeLadder(routine);
            case ST:
                return decodeStructuredText(routine);
            case FBD:
                return List.of(summarizeFunctionBlocks(routine));
            case SFC:
                return List.of(summarizeChart(routine));
            default:
                log.debug("Routine type '{}' has no decoder, emitting placeholder", declaredType);
                return List.of(LogicItem.Unknown.of(declaredType == null ? "" : declaredType));
        }
    }

    private List<LogicItem> decodeLadder(Element routine) {
        List<LogicItem> rungs = new ArrayList<>();
        for (Element rung : document.findAll("RLLContent/Rung", routine)) {
            String mainComment = "";
            Map<String, String> operandComments = new LinkedHashMap<>();
            for (Element comment : document.findAll("Comment", rung)) {
                String text = document.text(comment).strip();
                if (text.isEmpty()) {
                    continue;
                }
                String operand = L5xDocument.attribute(comment, "Operand", "");
                if (operand.isEmpty()) {
                    mainComment = text;
                } else {
                    operandComments.put(operand, text);
                }
            }

            rungs.add(new LogicItem.Rung(
                    L5xDocument.attribute(rung, "Number", ""),
                    L5xDocument.attribute(rung, "Type", LogicItem.Rung.NORMAL),
                    mainComment,
                    operandComments,
                    // 梯级文本中的空白有意义，不能 trim
                    document.text(document.find("Text", rung))
            ));
        }
        return rungs;
    }

    private List<LogicItem> decodeStructuredText(Element routine) {
        List<Element> contents = document.findAll("STContent", routine);
        if (contents.isEmpty()) {
            List<Element> bareLines = document.findAll("Line", routine);
            if (bareLines.isEmpty()) {
                return List.of();
            }
            return List.of(new LogicItem.StBlock("", joinLines(bareLines)));
        }

        List<LogicItem> blocks = new ArrayList<>(contents.size());
        for (Element content : contents) {
            blocks.add(new LogicItem.StBlock(
                    L5xDocument.attribute(content, "OnlineEditType", ""),
                    joinLines(document.findAll("Line", content))
            ));
        }
        return blocks;
    }

    private String joinLines(List<Element> lines) {
        List<String> code = new ArrayList<>(lines.size());
        for (Element line : lines) {
            code.add(document.text(line));
        }
        return String.join("\n", code);
    }

    private LogicItem summarizeFunctionBlocks(Element routine) {
        List<Element> sheets = document.findAll("FBDContent/Sheet", routine);
        int blocks = 0;
        int wires = 0;
        for (Element sheet : sheets) {
            blocks += document.findAll("Block", sheet).size();
            wires += document.findAll("Wire", sheet).size();
        }
        return new LogicItem.FbdSummary(sheets.size(), blocks, wires, LogicItem.FBD_NOTE);
    }

    private LogicItem summarizeChart(Element routine) {
        List<Element> steps = document.findAll("SFCContent/Step", routine);
        List<String> stepNames = new ArrayList<>(steps.size());
        for (Element step : steps) {
            stepNames.add(L5xDocument.attribute(step, "Name", UNNAMED_STEP));
        }
        return new LogicItem.SfcSummary(
                steps.size(),
                stepNames,
                document.findAll("SFCContent/Transition", routine).size(),
                document.findAll("SFCContent/ActionStructure", routine).size(),
                LogicItem.SFC_NOTE
        );
    }
}
