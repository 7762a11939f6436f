package com.example.ps3update.core;

import com.example.ps3update.exception.XmlParseException;
import com.example.ps3update.model.PackageInfo;
import com.example.ps3update.util.FileUtils;
import com.example.ps3update.util.FormatUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 解析官方 titlepatch XML
 * <p>
 * 典型结构:
 * <pre>
 * &lt;titlepatch titleid="BLES00779"&gt;
 *   &lt;tag name="..."&gt;
 *     &lt;package version="01.01" size="..." sha1sum="..." url="..." ps3_system_ver="03.4000"&gt;
 *       &lt;paramsfo&gt;&lt;TITLE&gt;...&lt;/TITLE&gt;&lt;/paramsfo&gt;
 *     &lt;/package&gt;
 *   &lt;/tag&gt;
 * &lt;/titlepatch&gt;
 * </pre>
 * 元素名大小写不敏感；tag 下没有 package 时再取根节点下的 package。
 * </p>
 */
public class UpdateXmlParser {

    public static final String UNKNOWN_TITLE = "Unknown Title";
    public static final String UNKNOWN_VERSION = "Unknown";

    private static final String[] HASH_ATTRIBUTES = {"sha1sum", "digest", "sha1"};

    private final XmlMapper xmlMapper = new XmlMapper();

    /**
     * 解析后的文档：游戏名 + 按文档顺序的更新包
     */
    public static final class ParsedDocument {
        private final String gameTitle;
        private final List<PackageInfo> packages;

        ParsedDocument(String gameTitle, List<PackageInfo> packages) {
            this.gameTitle = gameTitle;
            this.packages = packages;
        }

        public String getGameTitle() {
            return gameTitle;
        }

        public List<PackageInfo> getPackages() {
            return packages;
        }
    }

    public ParsedDocument parse(String xml) {
        JsonNode root;
        try {
            root = xmlMapper.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new XmlParseException(e.getOriginalMessage(), e);
        }
        if (root == null) {
            throw new XmlParseException("empty document", null);
        }

        List<JsonNode> packageNodes = new ArrayList<>();
        for (JsonNode tag : children(root, "tag")) {
            packageNodes.addAll(children(tag, "package"));
        }
        if (packageNodes.isEmpty()) {
            packageNodes.addAll(children(root, "package"));
        }

        List<PackageInfo> packages = new ArrayList<>(packageNodes.size());
        for (JsonNode node : packageNodes) {
            packages.add(toPackageInfo(node));
        }
        return new ParsedDocument(extractTitle(root), packages);
    }

    private PackageInfo toPackageInfo(JsonNode node) {
        String url = attribute(node, "url");
        String version = attribute(node, "version");
        long size = parseSize(attribute(node, "size"));

        String sha1 = "";
        for (String name : HASH_ATTRIBUTES) {
            String value = attribute(node, name);
            if (!value.isEmpty()) {
                sha1 = value;
                break;
            }
        }

        return PackageInfo.builder()
                .version(version.isEmpty() ? UNKNOWN_VERSION : version)
                .systemVersion(attribute(node, "ps3_system_ver"))
                .sizeBytes(size)
                .sizeHuman(FormatUtils.formatSize(size))
                .url(url)
                .sha1(sha1)
                .filename(FileUtils.fileNameFromUrl(url))
                .build();
    }

    private static String extractTitle(JsonNode root) {
        JsonNode title = root.findValue("TITLE");
        String text = title == null ? "" : text(title);
        return text.isEmpty() ? UNKNOWN_TITLE : text;
    }

    private static long parseSize(String value) {
        try {
            return value.isEmpty() ? 0 : Math.max(Long.parseLong(value), 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * 取出指定名字（忽略大小写）的子元素；重复元素会被 Jackson 合并为数组
     */
    private static List<JsonNode> children(JsonNode parent, String name) {
        List<JsonNode> result = new ArrayList<>();
        if (!parent.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parent.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().equalsIgnoreCase(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isArray()) {
                value.forEach(item -> {
                    if (item.isObject()) {
                        result.add(item);
                    }
                });
            } else if (value.isObject()) {
                result.add(value);
            }
        }
        return result;
    }

    private static String attribute(JsonNode node, String name) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equalsIgnoreCase(name) && field.getValue().isValueNode()) {
                return field.getValue().asText().trim();
            }
        }
        return "";
    }

    private static String text(JsonNode node) {
        if (node.isValueNode()) {
            return node.asText().trim();
        }
        // 带属性的文本元素，文本内容在空字段名下
        JsonNode inner = node.get("");
        return inner != null && inner.isValueNode() ? inner.asText().trim() : "";
    }
}
