package com.company.timeseries.exception;

public class RepositoryNotFoundException extends RuntimeException {
    public RepositoryNotFoundException(long repoId) {
        super("Repository not found: " + repoId);
    }
}
