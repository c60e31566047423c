package com.plotbinding.core.renderer.impl;

import com.plotbinding.core.renderer.BundleRenderer;
import com.plotbinding.core.resources.AssetBundle;
import com.plotbinding.core.resources.ResourceReference;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a bundle as an HTML fragment for a document's {@code <head>}.
 *
 * <p>Stylesheets come first as {@code <link>} or {@code <style>} elements, followed by
 * scripts as {@code <script src>} or inline {@code <script>} elements.
 *
 * <p><b>Example Output:</b>
 * <pre>{@code
 * <link rel="stylesheet" href="http://cdn.pydata.org/bokeh/release/bokeh-0.8.2.min.css" type="text/css" />
 * <script type="text/javascript" src="http://cdn.pydata.org/bokeh/release/bokeh-0.8.2.min.js"></script>
 * <script type="text/javascript">
 * Bokeh.set_log_level('info');
 * </script>
 * }</pre>
 */
public class HtmlBundleRenderer implements BundleRenderer {

    @Override
    public String getId() {
        return "html";
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    @Override
    public String render(AssetBundle bundle) {
        StringBuilder html = new StringBuilder();
        for (ResourceReference style : bundle.styles()) {
            if (style.isInline()) {
                html.append("<style type=\"text/css\">\n")
                    .append(escapeRawText(style.value(), "style"))
                    .append("\n</style>\n");
            } else {
                html.append("<link rel=\"stylesheet\" href=\"")
                    .append(escapeAttribute(href(style)))
                    .append("\" type=\"text/css\" />\n");
            }
        }
        for (ResourceReference script : bundle.scripts()) {
            if (script.isInline()) {
                html.append("<script type=\"text/javascript\">\n")
                    .append(escapeRawText(script.value(), "script"))
                    .append("\n</script>\n");
            } else {
                html.append("<script type=\"text/javascript\" src=\"")
                    .append(escapeAttribute(href(script)))
                    .append("\"></script>\n");
            }
        }
        return html.toString();
    }

    /**
     * File references use forward slashes so they work as relative URLs on every platform.
     */
    private static String href(ResourceReference reference) {
        if (reference.location() == ResourceReference.Location.FILE) {
            return reference.value().replace('\\', '/');
        }
        return reference.value();
    }

    static String escapeAttribute(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /**
     * Raw text elements end at the first closing tag of the same name, in any letter
     * case, so only that sequence needs breaking up.
     */
    static String escapeRawText(String text, String element) {
        Pattern closingTag = Pattern.compile("</(" + Pattern.quote(element) + ")", Pattern.CASE_INSENSITIVE);
        return closingTag.matcher(text).replaceAll(match -> Matcher.quoteReplacement("<\\/" + match.group(1)));
    }
}
