package com.ramsbaby.notifier.component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;

public final class MailPreviews {

    private static final int MAX_CHARS = 200;
    private static final int MAX_LINES = 2;

    private static final Pattern P_URL = Pattern.compile("\\[https?://[^\\]]+\\]|https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_CID = Pattern.compile("\\[cid:[^\\]]+\\]|cid:[\\w.@-]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_NOISE_LINE = Pattern.compile("^\\[?(cid|image|img):", Pattern.CASE_INSENSITIVE);

    private MailPreviews() {
    }

    /**
     * 본문에서 의미 있는 앞 2줄(최대 200자)을 뽑는다. HTML, URL, cid 참조는 제거.
     */
    public static String build(String body) {
        if (body == null || body.isBlank())
            return "";
        String cleaned = toPlainText(body);
        cleaned = P_URL.matcher(cleaned).replaceAll(" ");
        cleaned = P_CID.matcher(cleaned).replaceAll(" ");

        List<String> lines = new ArrayList<>();
        for (String line : cleaned.split("\\R")) {
            String s = line.replaceAll("[ \\t]+", " ").trim();
            if (s.isEmpty() || P_NOISE_LINE.matcher(s).find())
                continue;
            lines.add(s);
            if (lines.size() >= MAX_LINES)
                break;
        }
        String preview = String.join("\n", lines);
        if (preview.length() > MAX_CHARS)
            preview = preview.substring(0, MAX_CHARS).stripTrailing();
        return preview;
    }

    private static String toPlainText(String body) {
        String s = body.replace('\u00A0', ' ');
        if (!(s.contains("<") && s.contains(">")))
            return s;
        // 블록 경계는 줄바꿈으로 살려둔다
        Document doc = Jsoup.parse(s);
        doc.select("br, p, div, li, tr").forEach(e -> e.after(new TextNode("\n")));
        return doc.body().wholeText().replace('\u00A0', ' ');
    }
}
