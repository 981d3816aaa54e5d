package com.eyelevel.jobengine.dto.metric;

import com.eyelevel.jobengine.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobTypeCount {
    private JobType type;
    private Long count;
}
