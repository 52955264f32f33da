package com.kg.core.service.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRegistrationRequest {

    private List<String> capabilities = new ArrayList<>();

    private JsonNode schema;
}
