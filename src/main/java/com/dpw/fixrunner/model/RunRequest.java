package com.dpw.fixrunner.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Document(collection = "run_requests")
public class RunRequest {
    @Id
    private String id;
    private String inputFile; // path readable by the runner host
    private String csv;       // inline CSV content, used when inputFile is empty
    private LocalDateTime createdAt;
    private String status; // PENDING, PROCESSING, COMPLETED, FAILED

    public String describeInput() {
        return inputFile != null && !inputFile.isBlank() ? inputFile : "inline-csv";
    }
}
