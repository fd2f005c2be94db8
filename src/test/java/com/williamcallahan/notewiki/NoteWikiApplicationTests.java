package com.williamcallahan.notewiki;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class NoteWikiApplicationTests {

    @Autowired
    MockMvc mvc;

    @Test
    void contextLoads() {
    }

    @Test
    void corpusUploadFeedsLinkTitlesAndBacklinks() throws Exception {
        mvc.perform(put("/api/corpus").contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\":{"
                    + "\"groups\":\"\\\\Title{Groups}\\nSee \\\\wref{rings}.\","
                    + "\"rings\":\"\\\\Title{Rings}\\nBuilt on \\\\wref{groups}.\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.noteCount").value(2));

        mvc.perform(post("/api/notes/page").contentType(MediaType.APPLICATION_JSON)
                .content("{\"noteId\":\"groups\",\"content\":\"\\\\Title{Groups}\\nSee \\\\wref{rings}.\"}"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("<title>Groups - GWiki</title>")))
            .andExpect(content().string(containsString("<a href=\"rings.html\">Rings</a>")))
            .andExpect(content().string(containsString("Backlinks")));
    }
}
