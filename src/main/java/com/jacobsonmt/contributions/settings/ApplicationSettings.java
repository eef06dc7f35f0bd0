package com.jacobsonmt.contributions.settings;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "contributions.settings")
@Getter
@Setter
public class ApplicationSettings {

    private int concurrentJobs = 2;
    private boolean purgeSavedJobs = true;
    private int purgeSavedJobsTimeHours = 1;
    private int purgeAfterHours = 24;

}
