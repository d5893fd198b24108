// file: src/main/java/io/tabver/server/dto/DuplicateResponse.java
package io.tabver.server.dto;

/** 409 body when the uploaded content already exists for the document. */
public class DuplicateResponse {
    public String error;
    public String existingVersionId;
}
