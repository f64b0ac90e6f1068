package com.imperium.riskguide.common.exception;

/**
 * 读接口找不到对应记录（会话、报告文件等），映射为 404 not_found。
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String id;

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found with ID: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
