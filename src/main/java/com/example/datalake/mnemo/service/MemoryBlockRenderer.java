package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders retrieved knowledge as the {@code <memory>} block appended to a system prompt.
 * Every stored item carries its id so the assistant can refer back to it.
 */
public class MemoryBlockRenderer {

    static final String DEFAULT_CATEGORY = "general";
    static final String PROJECT_CONTEXT_CATEGORY = "project_context";

    /**
     * @return the block, or an empty string when every list is empty
     */
    public String render(List<KnowledgeItem> facts,
                         List<KnowledgeItem> goals,
                         List<KnowledgeItem> listItems,
                         List<String> projectContext) {
        if (facts.isEmpty() && goals.isEmpty() && listItems.isEmpty() && projectContext.isEmpty()) {
            return "";
        }

        StringJoiner out = new StringJoiner("\n");
        out.add("<memory>");

        if (!facts.isEmpty() || !projectContext.isEmpty()) {
            out.add("  <facts>");
            for (KnowledgeItem f : facts) {
                String category = f.getMetadata().category() == null ? DEFAULT_CATEGORY : f.getMetadata().category();
                out.add("    <fact" + idAttr(f) + " category='" + escapeAttribute(category) + "'>" + escape(f.getContent()) + "</fact>");
            }
            for (String p : projectContext) {
                out.add("    <fact category='" + PROJECT_CONTEXT_CATEGORY + "'>" + escape(p) + "</fact>");
            }
            out.add("  </facts>");
        }

        if (!goals.isEmpty()) {
            out.add("  <goals>");
            for (KnowledgeItem g : goals) {
                KnowledgeMetadata meta = g.getMetadata();
                String suffix = meta.description() == null || meta.description().isBlank()
                        ? ""
                        : " — " + meta.description();
                out.add("    <goal" + idAttr(g) + ">" + escape(g.getContent() + suffix) + "</goal>");
            }
            out.add("  </goals>");
        }

        if (!listItems.isEmpty()) {
            out.add("  <list_items>");
            for (KnowledgeItem i : listItems) {
                out.add("    <item" + idAttr(i) + ">" + escape(i.getContent()) + "</item>");
            }
            out.add("  </list_items>");
        }

        out.add("</memory>");
        return out.toString();
    }

    private static String idAttr(KnowledgeItem item) {
        return item.getId() == null ? "" : " id='" + item.getId() + "'";
    }

    static String escape(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeAttribute(String raw) {
        return escape(raw).replace("'", "&apos;");
    }
}
