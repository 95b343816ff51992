package com.boardsync.crawl.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.Set;

/**
 * Block-aware HTML to text conversion. Unlike {@link Element#text()}, paragraph, list and heading
 * boundaries survive as line breaks so section headers stay on their own lines.
 */
public final class HtmlText {
    private static final Set<String> BLOCK_TAGS = Set.of(
        "p", "div", "br", "li", "ul", "ol", "h1", "h2", "h3", "h4", "h5", "h6",
        "section", "article", "header", "footer", "tr", "table", "dd", "dt", "blockquote"
    );

    private HtmlText() {
    }

    public static String fromHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.select("script, style, noscript, svg").remove();
        return fromElement(document.body() == null ? document : document.body());
    }

    public static String fromElement(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    String text = textNode.text();
                    if (!text.isBlank()) {
                        out.append(text);
                    }
                } else if (node instanceof Element child) {
                    if ("li".equals(child.normalName())) {
                        newLine(out);
                        out.append("- ");
                    } else if (BLOCK_TAGS.contains(child.normalName())) {
                        newLine(out);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element child && BLOCK_TAGS.contains(child.normalName())) {
                    newLine(out);
                }
            }
        }, element);
        return out.toString()
            .replace(' ', ' ')
            .replaceAll("[ \\t]+", " ")
            .replaceAll(" *\\n *", "\n")
            .replaceAll("\\n{3,}", "\n\n")
            .trim();
    }

    private static void newLine(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
    }
}
