package com.example.smartroll.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouterPushRequest {

    @JsonProperty("connected_devices")
    private List<ConnectedDevice> connectedDevices = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectedDevice {
        private String mac;
        private String ip;
    }
}
