package com.buildmender.service;

/**
 * Body of POST /repair/update-and-build.
 */
public class RepairRequest {

    private String projectUrl;
    private String dependencyName;
    private String dependencyValue;

    public RepairRequest() {
    }

    public RepairRequest(String projectUrl, String dependencyName, String dependencyValue) {
        this.projectUrl = projectUrl;
        this.dependencyName = dependencyName;
        this.dependencyValue = dependencyValue;
    }

    public boolean isComplete() {
        return !isBlank(projectUrl) && !isBlank(dependencyName) && !isBlank(dependencyValue);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public String getProjectUrl() {
        return projectUrl;
    }

    public void setProjectUrl(String projectUrl) {
        this.projectUrl = projectUrl;
    }

    public String getDependencyName() {
        return dependencyName;
    }

    public void setDependencyName(String dependencyName) {
        this.dependencyName = dependencyName;
    }

    public String getDependencyValue() {
        return dependencyValue;
    }

    public void setDependencyValue(String dependencyValue) {
        this.dependencyValue = dependencyValue;
    }

    @Override
    public String toString() {
        return "RepairRequest{projectUrl=" + projectUrl + ", " + dependencyName + "=" + dependencyValue + "}";
    }
}
