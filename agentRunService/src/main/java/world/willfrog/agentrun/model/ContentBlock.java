package world.willfrog.agentrun.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结构化消息中的一个内容块，例如 text / image_url / tool_execution。
 * <p>
 * 字段按插入顺序保存，保证序列化结果稳定（压缩估算依赖这一点）。
 */
@Value
public class ContentBlock {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE_URL = "image_url";
    public static final String TYPE_TOOL_EXECUTION = "tool_execution";

    String type;
    Map<String, Object> fields;

    public ContentBlock(String type, Map<String, Object> fields) {
        this.type = type;
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ContentBlock text(String text) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", text == null ? "" : text);
        return new ContentBlock(TYPE_TEXT, fields);
    }

    public static ContentBlock imageUrl(String url) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("url", url);
        return new ContentBlock(TYPE_IMAGE_URL, fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public boolean isType(String expected) {
        return expected != null && expected.equals(type);
    }

    /**
     * 返回去掉指定字段、并追加替换字段后的新块；原块不变。
     */
    public ContentBlock replaceField(String removed, String addedName, Object addedValue) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove(removed);
        if (addedName != null) {
            copy.put(addedName, addedValue);
        }
        return new ContentBlock(type, copy);
    }

    /**
     * 序列化视图：type 在前，其余字段按原顺序。
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.putAll(fields);
        return map;
    }
}
