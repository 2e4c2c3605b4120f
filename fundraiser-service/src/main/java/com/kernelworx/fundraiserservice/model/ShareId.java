package com.kernelworx.fundraiserservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareId implements Serializable {

    private String profileId;
    private String targetAccountId;
}
