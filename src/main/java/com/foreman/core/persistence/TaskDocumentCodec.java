package com.foreman.core.persistence;

import com.foreman.core.model.Task;

/**
 * Converts between {@link Task} objects and their on-disk document form.
 */
public interface TaskDocumentCodec {

    /** File extension of the documents this codec produces, without the dot. */
    String fileExtension();

    String encode(Task task);

    Task decode(String content, String source);
}
