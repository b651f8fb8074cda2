package com.roomsignal.dto;

/**
 * Metadata of a file shared in a room. The file itself is hosted elsewhere;
 * only its URL is relayed.
 */
public class FileShareRequest {
    private String fileName;
    private Long fileSize;
    private String fileType;
    private String fileUrl;

    public FileShareRequest() {}

    public FileShareRequest(String fileName, Long fileSize, String fileType, String fileUrl) {
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.fileUrl = fileUrl;
    }

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }

    public String getFileType() { return fileType; }
    public void setFileType(String fileType) { this.fileType = fileType; }

    public String getFileUrl() { return fileUrl; }
    public void setFileUrl(String fileUrl) { this.fileUrl = fileUrl; }
}
