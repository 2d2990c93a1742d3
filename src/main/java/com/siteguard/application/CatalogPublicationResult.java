package com.siteguard.application;

public record CatalogPublicationResult(
    int releasesProcessed,
    int modulesCreated,
    int versionsCreated,
    int versionsPromoted,
    int sitesReevaluated
) {
}
