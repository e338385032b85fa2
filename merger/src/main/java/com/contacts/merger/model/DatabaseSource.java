package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseSource {
    private String server;
    private String database;
    private String user;
    @ToString.Exclude
    private String password;
    // null means the configured default query
    private String query;

    public boolean isConfigured() {
        return server != null && !server.isBlank() && database != null && !database.isBlank();
    }
}
