package com.example.audiobookfinder.domain.model;

import com.example.audiobookfinder.domain.enumtype.BookItemType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookItem {

    private String itemName;

    private String fullPath;

    private String author;

    private String title;

    private String searchQuery;

    private BookItemType type;
}
