package com.foreman.core.persistence;

import com.foreman.core.model.Task;

/**
 * Stores each task as a standalone JSON document.
 */
public class JsonTaskDocumentCodec implements TaskDocumentCodec {

    private final JsonDocuments json;

    public JsonTaskDocumentCodec(JsonDocuments json) {
        this.json = json;
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public String encode(Task task) {
        return json.write(task);
    }

    @Override
    public Task decode(String content, String source) {
        return json.read(content, Task.class, source);
    }
}
