package com.nana.reconcile.diff;

import org.bitbucket.cowwoc.diffmatchpatch.DiffMatchPatch;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * {@link DiffEngine} backed by the diff-match-patch algorithm.
 *
 * <p>Rendering follows the library's pretty-HTML format: inserted text in
 * {@code <ins>}, deleted text in {@code <del>}, kept text in
 * {@code <span>}, with HTML special characters escaped and line breaks
 * shown as {@code &para;<br>}.
 */
public class DiffMatchPatchEngine implements DiffEngine {

    private static final String INS_OPEN = "<ins style=\"background:#e6ffe6;\">";
    private static final String DEL_OPEN = "<del style=\"background:#ffe6e6;\">";

    private final DiffMatchPatch dmp = new DiffMatchPatch();

    @Override
    public List<Edit> diff(String before, String after) {
        LinkedList<DiffMatchPatch.Diff> diffs = dmp.diffMain(
                before == null ? "" : before,
                after == null ? "" : after);
        dmp.diffCleanupSemantic(diffs);
        List<Edit> edits = new ArrayList<>(diffs.size());
        for (DiffMatchPatch.Diff d : diffs) {
            edits.add(new Edit(toOperation(d.operation), d.text));
        }
        return edits;
    }

    @Override
    public String render(List<Edit> edits) {
        StringBuilder html = new StringBuilder();
        for (Edit edit : edits) {
            String text = escape(edit.getText());
            switch (edit.getOperation()) {
                case INSERT -> html.append(INS_OPEN).append(text).append("</ins>");
                case DELETE -> html.append(DEL_OPEN).append(text).append("</del>");
                case EQUAL -> html.append("<span>").append(text).append("</span>");
            }
        }
        return html.toString();
    }

    private static Edit.Operation toOperation(DiffMatchPatch.Operation op) {
        return switch (op) {
            case INSERT -> Edit.Operation.INSERT;
            case DELETE -> Edit.Operation.DELETE;
            case EQUAL -> Edit.Operation.EQUAL;
        };
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\n", "&para;<br>");
    }
}
