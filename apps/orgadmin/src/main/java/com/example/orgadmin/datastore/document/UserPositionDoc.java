package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@Document(collection = "user_positions")
public class UserPositionDoc {

    @Id
    private String id;

    @Indexed
    private String userProfileId;

    private String positionId;

    private boolean active;
}
