package dev.schedin.polling;

import dev.schedin.job.Job;

import java.time.Duration;
import java.util.List;

/** Something that can report the jobs due within a lookahead window. */
@FunctionalInterface
public interface DueJobSource {
  List<Job> selectDue(Duration lookahead);
}
