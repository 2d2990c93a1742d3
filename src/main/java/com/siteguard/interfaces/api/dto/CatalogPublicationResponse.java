package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogPublicationResponse {

    private int releasesProcessed;
    private int modulesCreated;
    private int versionsCreated;
    private int versionsPromoted;
    private int sitesReevaluated;
}
