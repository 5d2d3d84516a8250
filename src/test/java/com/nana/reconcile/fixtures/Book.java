package com.nana.reconcile.fixtures;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class Book {

    private Integer id;
    private String name;
    private Author author;
    private BigDecimal price;
    private LocalDate published;
    private Boolean available;
    private List<Category> categories = new ArrayList<>();

    public Integer getId() { return id; }

    public void setId(Integer id) { this.id = id; }

    public String getName() { return name; }

    public void setName(String name) { this.name = name; }

    public Author getAuthor() { return author; }

    public void setAuthor(Author author) { this.author = author; }

    public BigDecimal getPrice() { return price; }

    public void setPrice(BigDecimal price) { this.price = price; }

    public LocalDate getPublished() { return published; }

    public void setPublished(LocalDate published) { this.published = published; }

    public Boolean getAvailable() { return available; }

    public void setAvailable(Boolean available) { this.available = available; }

    public Collection<Category> getCategories() { return categories; }

    public void setCategories(Collection<Category> categories) {
        this.categories = categories == null ? new ArrayList<>() : new ArrayList<>(categories);
    }

    @Override
    public String toString() {
        return name;
    }
}
