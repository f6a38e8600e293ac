package com.example.audiobookfinder.api.response;

import com.example.audiobookfinder.domain.model.BookItem;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookListResponse {

    private List<BookItem> books;
}
