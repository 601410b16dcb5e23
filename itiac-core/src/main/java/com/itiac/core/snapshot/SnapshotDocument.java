package com.itiac.core.snapshot;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a snapshot, as exported by the product. Every field is optional here;
 * {@link SnapshotConverter} decides what is required.
 *
 * @param components component documents
 * @param dependencies dependency documents
 * @param workflows workflow documents
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
    @JsonProperty("components") List<ComponentDocument> components,
    @JsonProperty("dependencies") List<DependencyDocument> dependencies,
    @JsonProperty("workflows") List<WorkflowDocument> workflows
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("criticality") String criticality,
        @JsonProperty("description") String description,
        @JsonProperty("location") String location,
        @JsonProperty("owner") String owner,
        @JsonProperty("vendor") String vendor,
        @JsonProperty("lastModified") @JsonAlias("lastUpdated") String lastModified,
        @JsonProperty("metadata") Map<String, Object> metadata
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DependencyDocument(
        @JsonProperty("id") String id,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("targetId") String targetId,
        @JsonProperty("type") String type,
        @JsonProperty("criticality") String criticality,
        @JsonProperty("description") String description
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkflowDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("businessProcess") String businessProcess,
        @JsonProperty("criticality") String criticality,
        @JsonProperty("owner") String owner,
        @JsonProperty("lastModified") @JsonAlias("lastUpdated") String lastModified,
        @JsonProperty("steps") List<StepDocument> steps
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StepDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("order") Integer order,
        @JsonProperty("primaryComponentId") String primaryComponentId,
        @JsonProperty("primaryComponentIds") List<String> primaryComponentIds,
        @JsonProperty("alternativeComponentIds") List<String> alternativeComponentIds,
        @JsonProperty("fallbackWorkflowId") String fallbackWorkflowId
    ) {}
}
