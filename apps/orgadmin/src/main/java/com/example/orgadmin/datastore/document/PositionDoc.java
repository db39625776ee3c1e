package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@Document(collection = "positions")
public class PositionDoc {

    @Id
    private String id;

    private String name;

    private String departmentId;

    private boolean active;
}
