package com.nsqlexec.data;

import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.table.TableStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One question over one table, with the candidate programs generated for it.
 */
public class Example {

    private final String eid;
    private final String sourceId;
    private final String question;
    private final List<Object> goldAnswer;
    private final TableStore table;
    private final List<CandidateProgram> programs;

    public Example(String eid, String sourceId, String question, List<Object> goldAnswer, TableStore table,
                   List<CandidateProgram> programs) {
        this.eid = eid;
        this.sourceId = sourceId;
        this.question = question;
        this.goldAnswer = Collections.unmodifiableList(new ArrayList<>(goldAnswer));
        this.table = table;
        this.programs = Collections.unmodifiableList(new ArrayList<>(programs));
    }

    /** Example identifier: the index of the example in the dataset file. */
    public String getEid() { return eid; }

    /** Identifier given by the dataset itself, if any. */
    public String getSourceId() { return sourceId; }
    public String getQuestion() { return question; }
    public List<Object> getGoldAnswer() { return goldAnswer; }
    public TableStore getTable() { return table; }
    public List<CandidateProgram> getPrograms() { return programs; }

    @Override
    public String toString() {
        return "Example{eid=" + eid + ", question='" + question + "', programs=" + programs.size() + "}";
    }
}
