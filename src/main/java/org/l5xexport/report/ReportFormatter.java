package org.l5xexport.report;

import org.l5xexport.l5x.dto.ControllerInfo;
import org.l5xexport.l5x.dto.DataTypeDef;
import org.l5xexport.l5x.dto.DataTypeMember;
import org.l5xexport.l5x.dto.InstructionDef;
import org.l5xexport.l5x.dto.InstructionParameter;
import org.l5xexport.l5x.dto.IoModule;
import org.l5xexport.l5x.dto.LogicItem;
import org.l5xexport.l5x.dto.Program;
import org.l5xexport.l5x.dto.Routine;
import org.l5xexport.l5x.dto.Tag;
import org.l5xexport.l5x.dto.TaskDef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把抽取结果渲染为定宽、左对齐的纯文本报告。
 * <p>
 * 约定：
 * <ul>
 *   <li>列之间用 {@code " | "} 分隔，分隔线由与列宽等长的 {@code -} 组成。</li>
 *   <li>描述列超出预算时截断并追加 {@code ..}（标签 40、UDT 成员 35、AOI 参数与模块 30 个字符）。</li>
 *   <li>行之间用 {@code \n} 连接，末尾不带换行。</li>
 * </ul>
 * 所有方法都是纯函数，不做任何 IO。
 */
public class ReportFormatter {

    private static final int TAG_DESCRIPTION_BUDGET = 40;
    private static final int MEMBER_DESCRIPTION_BUDGET = 35;
    private static final int PARAMETER_DESCRIPTION_BUDGET = 30;
    private static final int MODULE_DESCRIPTION_BUDGET = 30;

    private static final List<String> CONTROLLER_PRIORITY_FIELDS = List.of("Name", "ProcessorType", "Revision", "Description");

    public String formatControllerInfo(ControllerInfo info) {
        List<String> lines = new ArrayList<>();
        for (String field : CONTROLLER_PRIORITY_FIELDS) {
            if (info.fields().containsKey(field)) {
                lines.add(field + ": " + info.get(field));
            }
        }
        for (Map.Entry<String, String> entry : info.fields().entrySet()) {
            if (!CONTROLLER_PRIORITY_FIELDS.contains(entry.getKey())) {
                lines.add(entry.getKey() + ": " + entry.getValue());
            }
        }
        return String.join("\n", lines);
    }

    public String formatGlobalTags(List<Tag> tags) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("%-30s | %-10s | %-30s | %s", "Name", "Usage", "Type/Alias", "Description"));
        lines.add(rule(30, 10, 30, 20));
        for (Tag tag : tags) {
            lines.add(formatTagLine(tag, ""));
        }
        return String.join("\n", lines);
    }

    /**
     * 只列出 {@code Class="User"} 的 UDT；隐藏成员不输出，但 UDT 本身仍计入总数。
     */
    public String formatDataTypes(List<DataTypeDef> dataTypes) {
        List<DataTypeDef> userTypes = new ArrayList<>();
        for (DataTypeDef dataType : dataTypes) {
            if (dataType.isUserDefined()) {
                userTypes.add(dataType);
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add("USER DEFINED TYPES (UDTs) - Found " + userTypes.size());
        lines.add(repeat('=', 80));

        for (DataTypeDef dataType : userTypes) {
            lines.add("\nUDT: " + dataType.name());
            if (!dataType.description().isEmpty()) {
                lines.add("Desc: " + dataType.description());
            }
            lines.add(repeat('-', 60));

            if (dataType.members().isEmpty()) {
                lines.add("  (No members)");
            } else {
                lines.add(String.format("  %-25s | %-26s | %s", "Member", "DataType", "Description"));
                lines.add("  " + rule(25, 26, 20));
                for (DataTypeMember member : dataType.members()) {
                    if (!member.hidden()) {
                        lines.add(formatMemberLine(member));
                    }
                }
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    public String formatInstructionDefinitions(List<InstructionDef> definitions) {
        List<String> lines = new ArrayList<>();
        lines.add("ADD-ON INSTRUCTIONS (AOIs) - Found " + definitions.size());
        lines.add(repeat('=', 80));

        for (InstructionDef aoi : definitions) {
            lines.add("\n" + repeat('#', 80));
            lines.add("AOI: " + aoi.name());
            if (!aoi.revision().isEmpty()) {
                lines.add("Revision: " + aoi.revision());
            }
            if (!aoi.vendor().isEmpty()) {
                lines.add("Vendor: " + aoi.vendor());
            }
            if (!aoi.description().isEmpty()) {
                lines.add("Desc: " + aoi.description());
            }
            lines.add(repeat('=', 70));

            lines.add("\n  [PARAMETERS] - Found " + aoi.parameters().size());
            if (!aoi.parameters().isEmpty()) {
                // 多一个空格，给 Required 标记 * 留位
                lines.add(String.format("   %-25s | %-8s | %-20s | %s", "Name", "Usage", "DataType", "Description"));
                lines.add("  " + rule(25, 8, 20, 20));
                for (InstructionParameter parameter : aoi.parameters()) {
                    lines.add(formatParameterLine(parameter));
                }
            }

            lines.add("\n  [LOCAL TAGS] - Found " + aoi.localTags().size());
            if (!aoi.localTags().isEmpty()) {
                lines.add(String.format("  %-30s | %-10s | %-30s | %s", "Name", "Usage", "Type", "Description"));
                lines.add("  " + rule(30, 10, 30, 20));
                for (Tag tag : aoi.localTags()) {
                    lines.add(formatTagLine(tag, "  "));
                }
            }

            lines.add("\n  [ROUTINES] - Found " + aoi.routines().size());
            for (Routine routine : aoi.routines()) {
                lines.addAll(formatRoutine(routine, "    "));
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    public String formatModules(List<IoModule> modules) {
        List<String> lines = new ArrayList<>();
        lines.add("I/O MODULES - Found " + modules.size());
        lines.add(repeat('=', 80));
        lines.add(String.format("\n%-25s | %-20s | %-20s | %s", "Name", "Catalog Number", "Parent", "Description"));
        lines.add(rule(25, 20, 20, 30));

        for (IoModule module : modules) {
            String parent = module.hasParent() ? module.parentModule() + ":" + module.parentModPortId() : "-";
            lines.add(String.format("%-25s | %-20s | %-20s | %s",
                    module.name(),
                    module.catalogNumber(),
                    parent,
                    truncate(module.description(), MODULE_DESCRIPTION_BUDGET)));
        }
        return String.join("\n", lines);
    }

    public String formatTasks(List<TaskDef> tasks) {
        List<String> lines = new ArrayList<>();
        lines.add("TASKS - Found " + tasks.size());
        lines.add(repeat('=', 80));

        for (TaskDef task : tasks) {
            lines.add("\nTASK: " + task.name());
            lines.add("  Type: " + task.type());
            if (!task.rate().isEmpty()) {
                lines.add("  Rate: " + task.rate() + " ms");
            }
            lines.add("  Priority: " + task.priority());
            if (!task.watchdog().isEmpty()) {
                lines.add("  Watchdog: " + task.watchdog() + " ms");
            }
            if (!task.description().isEmpty()) {
                lines.add("  Desc: " + task.description());
            }
            if (!task.scheduledPrograms().isEmpty()) {
                lines.add("  Scheduled Programs:");
                for (String program : task.scheduledPrograms()) {
                    lines.add("    - " + program);
                }
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    public String formatPrograms(List<Program> programs) {
        List<String> lines = new ArrayList<>();
        for (Program program : programs) {
            lines.add("PROGRAM: " + program.name());
            if (!program.description().isEmpty()) {
                lines.add("Desc: " + program.description());
            }
            if (!program.mainRoutineName().isEmpty()) {
                lines.add("Main Routine: " + program.mainRoutineName());
            }
            if (!program.faultRoutineName().isEmpty()) {
                lines.add("Fault Routine: " + program.faultRoutineName());
            }
            if (program.disabled()) {
                lines.add("*** PROGRAM DISABLED ***");
            }
            lines.add(repeat('=', 75));

            lines.add("\n  [LOCAL TAGS] - Found " + program.tags().size());
            if (!program.tags().isEmpty()) {
                lines.add(String.format("  %-30s | %-10s | %-30s | %s", "Name", "Usage", "Type/Alias", "Description"));
                lines.add("  " + rule(30, 10, 30, 20));
                for (Tag tag : program.tags()) {
                    lines.add(formatTagLine(tag, "  "));
                }
            }

            lines.add("\n  [ROUTINES & LOGIC] - Found " + program.routines().size());
            for (Routine routine : program.routines()) {
                lines.addAll(formatRoutine(routine, "    "));
            }

            lines.add("\n\n" + repeat('#', 80) + "\n");
        }
        return String.join("\n", lines);
    }

    public List<String> formatRoutine(Routine routine, String indent) {
        List<String> lines = new ArrayList<>();
        lines.add("\n" + indent + repeat('=', 60));
        lines.add(indent + "ROUTINE: " + routine.name() + " (" + routine.type() + ")");
        if (!routine.description().isEmpty()) {
            lines.add(indent + "Desc: " + routine.description());
        }
        lines.add(indent + repeat('=', 60));

        LogicLines renderer = new LogicLines(indent);
        for (LogicItem item : routine.logic()) {
            lines.addAll(item.accept(renderer));
        }
        return lines;
    }

    String formatTagLine(Tag tag, String indent) {
        String typeOrAlias = tag.isAlias() ? "Alias->" + tag.aliasFor() : tag.dataType();
        return String.format("%s%-30s | %-10s | %-30s | %s",
                indent, tag.name(), tag.usage(), typeOrAlias, truncate(tag.description(), TAG_DESCRIPTION_BUDGET));
    }

    String formatMemberLine(DataTypeMember member) {
        String dimension = member.dimension().isEmpty() ? "" : "[" + member.dimension() + "]";
        return String.format("  %-25s | %-20s%-6s | %s",
                member.name(), member.dataType(), dimension, truncate(member.description(), MEMBER_DESCRIPTION_BUDGET));
    }

    String formatParameterLine(InstructionParameter parameter) {
        String required = parameter.required() ? "*" : " ";
        return String.format("  %s%-24s | %-8s | %-20s | %s",
                required, parameter.name(), parameter.usage(), parameter.dataType(),
                truncate(parameter.description(), PARAMETER_DESCRIPTION_BUDGET));
    }

    static String truncate(String text, int budget) {
        return text.length() > budget ? text.substring(0, budget) + ".." : text;
    }

    private static String rule(int... widths) {
        List<String> parts = new ArrayList<>(widths.length);
        for (int width : widths) {
            parts.add(repeat('-', width));
        }
        return String.join(" | ", parts);
    }

    private static String repeat(char c, int count) {
        return String.valueOf(c).repeat(count);
    }

    /**
     * 逻辑条目 -> 文本行。
     */
    private static final class LogicLines implements LogicItem.Visitor<List<String>> {

        private final String indent;

        private LogicLines(String indent) {
            this.indent = indent;
        }

        @Override
        public List<String> visitRung(LogicItem.Rung rung) {
            List<String> lines = new ArrayList<>();
            lines.add(indent + "[Rung " + rung.number() + "]");
            if (!rung.isNormal()) {
                lines.add(indent + "  (Type: " + rung.rungType() + ")");
            }
            if (!rung.mainComment().isEmpty()) {
                lines.add(indent + "  /* " + rung.mainComment() + " */");
            }
            for (Map.Entry<String, String> comment : rung.operandComments().entrySet()) {
                lines.add(indent + "  /* " + comment.getKey() + ": " + comment.getValue() + " */");
            }
            if (!rung.code().isEmpty()) {
                lines.add(indent + "  " + rung.code());
            }
            lines.add(indent + "  " + repeat('-', 40));
            return lines;
        }

        @Override
        public List<String> visitStBlock(LogicItem.StBlock block) {
            List<String> lines = new ArrayList<>();
            if (block.isOnlineEdit()) {
                lines.add(indent + "[Structured Text - Online Edit: " + block.onlineEditType() + "]");
            } else {
                lines.add(indent + "[Structured Text Code]");
            }
            lines.add(indent + "  " + repeat('-', 40));
            // split 的 -1：保留末尾空行
            for (String line : block.code().split("\n", -1)) {
                lines.add(indent + "  " + line);
            }
            lines.add(indent + "  " + repeat('-', 40));
            return lines;
        }

        @Override
        public List<String> visitFbd(LogicItem.FbdSummary summary) {
            return List.of(
                    indent + "[Function Block Diagram]",
                    indent + "  Sheets: " + summary.sheetCount() + ", Blocks: " + summary.blockCount()
                            + ", Wires: " + summary.wireCount(),
                    indent + "  Note: " + summary.note()
            );
        }

        @Override
        public List<String> visitSfc(LogicItem.SfcSummary summary) {
            List<String> lines = new ArrayList<>();
            lines.add(indent + "[Sequential Function Chart]");
            lines.add(indent + "  Steps: " + summary.stepCount() + ", Transitions: " + summary.transitionCount()
                    + ", Actions: " + summary.actionCount());
            if (!summary.stepNames().isEmpty()) {
                lines.add(indent + "  Step Names: " + String.join(", ", summary.stepNames()));
            }
            lines.add(indent + "  Note: " + summary.note());
            return lines;
        }

        @Override
        public List<String> visitUnknown(LogicItem.Unknown unknown) {
            return List.of(
                    indent + "[" + unknown.kind() + "]",
                    indent + "  " + unknown.note()
            );
        }
    }
}
